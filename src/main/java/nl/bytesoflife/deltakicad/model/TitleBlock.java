package nl.bytesoflife.deltakicad.model;

import nl.bytesoflife.deltakicad.parser.SNode;

public record TitleBlock(String title, String date, String revision, String company) {

    public static final TitleBlock EMPTY = new TitleBlock("", "", "", "");

    static TitleBlock of(SNode.SList block) {
        return new TitleBlock(value(block, "title"), value(block, "date"), value(block, "rev"), value(block, "company"));
    }

    private static String value(SNode.SList block, String tag) {
        return block.first(tag).map(v -> v.atomValue(1)).orElse("");
    }
}
