package de.bsommerfeld.harvester.frameio;

/**
 * Project summary as returned by the project listing and lookup endpoints.
 *
 * @param rootFolderId entry point of the project's folder tree
 */
public record ProjectInfo(String id, String name, String rootFolderId) {
}
