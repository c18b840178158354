package de.bsommerfeld.harvester.harvest;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.List;
import java.util.Optional;
import java.util.function.Function;

/**
 * Extracts a display name from a comment. Anonymous reviewers and
 * registered users are stored in different places depending on how the
 * comment was made, so the candidates are tried in order.
 */
final class AuthorResolver {

    static final String UNKNOWN_AUTHOR = "Unknown User";

    private static final List<Function<JsonNode, JsonNode>> CANDIDATES = List.of(
            comment -> comment.path("author").path("anonymous_user"),
            comment -> comment.path("anonymous_user"),
            comment -> comment.path("author"));

    private static final List<String> NAME_FIELDS = List.of("name", "display_name", "full_name", "email");

    String resolve(JsonNode comment) {
        for (Function<JsonNode, JsonNode> candidate : CANDIDATES) {
            Optional<String> name = nameOf(candidate.apply(comment));
            if (name.isPresent())
                return name.get();
        }
        return UNKNOWN_AUTHOR;
    }

    private static Optional<String> nameOf(JsonNode node) {
        if (node.isTextual()) {
            String text = node.asText().trim();
            return text.isEmpty() ? Optional.empty() : Optional.of(text);
        }
        if (!node.isObject())
            return Optional.empty();
        for (String field : NAME_FIELDS) {
            JsonNode value = node.get(field);
            if (value != null && value.isTextual() && !value.asText().isBlank())
                return Optional.of(value.asText().trim());
        }
        return Optional.empty();
    }
}
