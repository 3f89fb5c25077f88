package com.vidnyan.semtree.domain.build;

import com.vidnyan.semtree.domain.model.NodeArena;
import com.vidnyan.semtree.domain.model.RawNode;
import com.vidnyan.semtree.domain.model.SemanticDocument;
import com.vidnyan.semtree.domain.model.SemanticNode;
import com.vidnyan.semtree.domain.model.SourceText;
import com.vidnyan.semtree.domain.rule.RuleTable;
import lombok.RequiredArgsConstructor;

/**
 * Builds the {@code ast} and {@code data} branches of a configuration file from one parse.
 * The CST is captured once, the capture is deep-copied, and each copy is rewritten by its own
 * table. Spans travel with the copies unchanged.
 */
@RequiredArgsConstructor
public class DualBranchAssembler {

    private final RewritingWalker walker;
    private final RawTreeCapture capture;

    public DualBranch buildDual(RawNode rawRoot, SourceText source, RuleTable astRules, RuleTable dataRules,
                                NodeArena arena) {
        int original = capture.capture(rawRoot, source, arena);
        int clone = arena.deepCopy(original);

        int ast = arena.createElement(SemanticDocument.AST);
        walker.emitInto(new ArenaRawNode(arena, original), source, astRules, arena, ast);

        int data = arena.createElement(SemanticDocument.DATA);
        walker.emitInto(new ArenaRawNode(arena, clone), source, dataRules, arena, data);

        return new DualBranch(arena.node(ast), arena.node(data));
    }

    public record DualBranch(SemanticNode ast, SemanticNode data) {}
}
