package de.bsommerfeld.harvester.frameio;

public record Team(String id, String name) {
}
