package dev.ebullient.mud.model;

public record DialogueLine(
        String npcName,
        String keyword,
        String text) {

    public String render() {
        return "%s says: \"%s\"".formatted(npcName, text);
    }
}
