package com.libragraph.sift.types;

/**
 * What a node of the result tree stands for.
 */
public enum ArtifactKind {
    /** A region some parser validated. */
    ARTIFACT(0, "artifact"),
    /** A region no parser validated, or one that was not examined because of a limit. */
    UNRECOGNIZED(1, "unrecognized data"),
    /** Byte-identical to a region already scanned in this session; linked, not re-scanned. */
    DUPLICATE(2, "duplicate"),
    /** Never examined because the session was cancelled first. */
    SKIPPED(3, "skipped"),
    /** Not one artifact as a whole, but split into carved artifacts and gaps. */
    CARVED(4, "carved");

    private final int id;
    private final String label;

    ArtifactKind(int id, String label) {
        this.id = id;
        this.label = label;
    }

    public int id() {
        return id;
    }

    public String label() {
        return label;
    }

    public static ArtifactKind fromId(int id) {
        for (ArtifactKind k : values()) {
            if (k.id == id) return k;
        }
        throw new IllegalArgumentException("Unknown ArtifactKind id: " + id);
    }
}
