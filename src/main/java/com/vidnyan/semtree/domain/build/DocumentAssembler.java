package com.vidnyan.semtree.domain.build;

import com.vidnyan.semtree.domain.model.NameTable;
import com.vidnyan.semtree.domain.model.NodeArena;
import com.vidnyan.semtree.domain.model.RawNode;
import com.vidnyan.semtree.domain.model.SemanticDocument;
import com.vidnyan.semtree.domain.model.SourceText;
import com.vidnyan.semtree.domain.rule.LanguageDefinition;

/**
 * Produces the file node for one source: a single content root for code languages,
 * {@code ast} and {@code data} branches for configuration formats, or an untransformed
 * capture in raw mode.
 */
public class DocumentAssembler {

    private final NameTable names;
    private final RewritingWalker walker;
    private final RawTreeCapture capture;
    private final DualBranchAssembler dualBranchAssembler;

    public DocumentAssembler(NameTable names) {
        this.names = names;
        this.walker = new RewritingWalker(names);
        this.capture = new RawTreeCapture();
        this.dualBranchAssembler = new DualBranchAssembler(walker, capture);
    }

    public SemanticDocument assemble(String path, LanguageDefinition language, RawNode root, SourceText source,
                                     boolean rawMode) {
        NodeArena arena = new NodeArena(names);
        int file = arena.createElement(SemanticDocument.FILE);
        arena.setAttribute(file, SemanticDocument.PATH, path);

        if (rawMode) {
            arena.appendChild(file, capture.capture(root, source, arena));
            return new SemanticDocument(path, language.id(), null, source, arena, file);
        }
        if (language.isDualBranch()) {
            arena.setAttribute(file, SemanticDocument.FORMAT, language.format().tag());
            DualBranchAssembler.DualBranch branches = dualBranchAssembler.buildDual(
                    root, source, language.astRules(), language.dataRules(), arena);
            arena.appendChild(file, branches.ast().id());
            arena.appendChild(file, branches.data().id());
            return new SemanticDocument(path, language.id(), language.format(), source, arena, file);
        }
        walker.buildInto(root, source, language.rules(), arena, file);
        return new SemanticDocument(path, language.id(), null, source, arena, file);
    }
}
