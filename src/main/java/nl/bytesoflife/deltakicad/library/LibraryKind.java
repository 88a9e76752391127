package nl.bytesoflife.deltakicad.library;

public enum LibraryKind {
    SYMBOL("sym-lib-table", "sym_lib_table"),
    FOOTPRINT("fp-lib-table", "fp_lib_table"),
    BOTH(null, null);

    private final String tableFile;
    private final String tableTag;

    LibraryKind(String tableFile, String tableTag) {
        this.tableFile = tableFile;
        this.tableTag = tableTag;
    }

    public String getTableFile() {
        return tableFile;
    }

    public String getTableTag() {
        return tableTag;
    }

    public boolean includesSymbols() {
        return this == SYMBOL || this == BOTH;
    }

    public boolean includesFootprints() {
        return this == FOOTPRINT || this == BOTH;
    }
}
