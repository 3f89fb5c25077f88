package com.vidnyan.semtree.domain.model;

import java.util.Optional;

/**
 * The file node of one parsed source: a {@code File} element carrying the path and, for
 * configuration formats, the {@code format} tag with {@code ast} and {@code data} children.
 */
public record SemanticDocument(
    String path,
    String language,
    ConfigFormat format,
    SourceText source,
    NodeArena arena,
    int fileNodeId
) {

    public static final String FILE = "File";
    public static final String PATH = "path";
    public static final String FORMAT = "format";
    public static final String AST = "ast";
    public static final String DATA = "data";

    public SemanticNode fileNode() {
        return arena.node(fileNodeId);
    }

    public boolean isDualBranch() {
        return format != null;
    }

    public Optional<SemanticNode> ast() {
        return fileNode().element(AST);
    }

    public Optional<SemanticNode> data() {
        return fileNode().element(DATA);
    }

    /**
     * The single content root of a code file, or the {@code ast} branch of a config file.
     */
    public Optional<SemanticNode> content() {
        if (isDualBranch()) {
            return ast();
        }
        return fileNode().elements().stream().findFirst();
    }
}
