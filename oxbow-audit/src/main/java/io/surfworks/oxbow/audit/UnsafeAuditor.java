package io.surfworks.oxbow.audit;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.logging.Logger;

import io.surfworks.oxbow.audit.syntax.RustAst.Block;
import io.surfworks.oxbow.audit.syntax.RustAst.BlockExpr;
import io.surfworks.oxbow.audit.syntax.RustAst.ControlFlow;
import io.surfworks.oxbow.audit.syntax.RustAst.Expr;
import io.surfworks.oxbow.audit.syntax.RustAst.ExprStmt;
import io.surfworks.oxbow.audit.syntax.RustAst.ExternBlock;
import io.surfworks.oxbow.audit.syntax.RustAst.FnItem;
import io.surfworks.oxbow.audit.syntax.RustAst.Group;
import io.surfworks.oxbow.audit.syntax.RustAst.ImplItem;
import io.surfworks.oxbow.audit.syntax.RustAst.Item;
import io.surfworks.oxbow.audit.syntax.RustAst.ItemStmt;
import io.surfworks.oxbow.audit.syntax.RustAst.Leaf;
import io.surfworks.oxbow.audit.syntax.RustAst.MacroCall;
import io.surfworks.oxbow.audit.syntax.RustAst.ModItem;
import io.surfworks.oxbow.audit.syntax.RustAst.OtherItem;
import io.surfworks.oxbow.audit.syntax.RustAst.SourceFile;
import io.surfworks.oxbow.audit.syntax.RustAst.StaticItem;
import io.surfworks.oxbow.audit.syntax.RustAst.Stmt;
import io.surfworks.oxbow.audit.syntax.RustAst.UnionItem;
import io.surfworks.oxbow.audit.syntax.RustAst.UnsafeBlock;
import io.surfworks.oxbow.audit.syntax.RustParseException;
import io.surfworks.oxbow.audit.syntax.RustParser;
import io.surfworks.oxbow.audit.syntax.RustTokenizer.Token;

/**
 * Measures how much of a Rust source file still needs {@code unsafe}.
 *
 * <p>Every {@code unsafe { }} block and every {@code unsafe fn} with a body becomes an
 * {@link UnsafeRegion}, classified by the first matching entry of the heuristic table.
 * Regions nested inside other regions are reported separately.
 *
 * <p>The auditor holds no state; the same text always yields an equal report.
 *
 * <p>Example usage:
 * <pre>{@code
 * AuditReport report = new UnsafeAuditor().audit(rustSource);
 * if (!report.meetsDensityTarget()) {
 *     report.highConfidenceRegions().forEach(r -> System.out.println(r.remediation()));
 * }
 * }</pre>
 */
public final class UnsafeAuditor {

    private static final Logger LOG = Logger.getLogger(UnsafeAuditor.class.getName());

    private final List<RiskHeuristic> heuristics;

    public UnsafeAuditor() {
        this(RiskHeuristic.STANDARD);
    }

    /**
     * Creates an auditor with a custom heuristic table. The last entry should match everything.
     */
    public UnsafeAuditor(List<RiskHeuristic> heuristics) {
        Objects.requireNonNull(heuristics, "heuristics cannot be null");
        if (heuristics.isEmpty()) {
            throw new IllegalArgumentException("heuristics cannot be empty");
        }
        this.heuristics = List.copyOf(heuristics);
    }

    /**
     * Audits Rust source text.
     *
     * @param source the Rust source
     * @return the audit report
     * @throws RustParseException if the text is not valid Rust; no partial report is produced
     */
    public AuditReport audit(String source) {
        Objects.requireNonNull(source, "source cannot be null");

        SourceFile file = RustParser.parse(source);
        FileSymbols symbols = collectSymbols(file.items());

        List<UnsafeRegion> regions = new ArrayList<>();
        for (Item item : file.items()) {
            walkItem(item, symbols, regions);
        }

        int totalLines = (int) source.lines().count();
        int attributed = regions.stream().mapToInt(UnsafeRegion::lineCount).sum();
        int unsafeLines = Math.min(attributed, totalLines);
        double density = totalLines == 0 ? 0.0 : unsafeLines * 100.0 / totalLines;
        double average = regions.stream().mapToInt(UnsafeRegion::confidence).average().orElse(0.0);

        AuditReport report = new AuditReport(totalLines, unsafeLines, density, regions, average);
        LOG.fine(() -> String.format("Audited %d line(s): %d region(s), density %.2f%%",
                totalLines, regions.size(), density));
        return report;
    }

    // ==================== Symbols ====================

    private static FileSymbols collectSymbols(List<Item> items) {
        Set<String> externs = new HashSet<>();
        Set<String> statics = new HashSet<>();
        Set<String> unions = new HashSet<>();
        collectSymbols(items, externs, statics, unions);
        return new FileSymbols(externs, statics, unions);
    }

    private static void collectSymbols(List<Item> items, Set<String> externs, Set<String> statics,
                                       Set<String> unions) {
        for (Item item : items) {
            if (item instanceof ExternBlock block) {
                externs.addAll(block.functions());
                for (StaticItem s : block.statics()) {
                    if (s.mutable()) {
                        statics.add(s.name());
                    }
                }
            } else if (item instanceof StaticItem s) {
                if (s.mutable()) {
                    statics.add(s.name());
                }
            } else if (item instanceof UnionItem union) {
                unions.add(union.name());
            } else if (item instanceof ModItem mod) {
                collectSymbols(mod.items(), externs, statics, unions);
            } else if (item instanceof ImplItem impl) {
                collectSymbols(impl.items(), externs, statics, unions);
            }
        }
    }

    // ==================== Traversal ====================

    private void walkItem(Item item, FileSymbols symbols, List<UnsafeRegion> regions) {
        if (item instanceof FnItem fn) {
            if (!fn.hasBody()) {
                return;
            }
            if (fn.isUnsafe()) {
                regions.add(classify(fn.line(), RegionForm.FUNCTION, fn.body(), symbols));
            }
            walkBlock(fn.body(), symbols, regions);
        } else if (item instanceof ModItem mod) {
            for (Item inner : mod.items()) {
                walkItem(inner, symbols, regions);
            }
        } else if (item instanceof ImplItem impl) {
            for (Item inner : impl.items()) {
                walkItem(inner, symbols, regions);
            }
        } else if (item instanceof ExternBlock || item instanceof StaticItem || item instanceof UnionItem
                || item instanceof OtherItem) {
            return;
        } else {
            throw new IllegalStateException("Unhandled item: " + item);
        }
    }

    private void walkBlock(Block block, FileSymbols symbols, List<UnsafeRegion> regions) {
        for (Stmt stmt : block.statements()) {
            if (stmt instanceof ItemStmt itemStmt) {
                walkItem(itemStmt.item(), symbols, regions);
            } else if (stmt instanceof ExprStmt exprStmt) {
                walkExprs(exprStmt.parts(), symbols, regions);
            } else {
                throw new IllegalStateException("Unhandled statement: " + stmt);
            }
        }
    }

    private void walkExprs(List<Expr> parts, FileSymbols symbols, List<UnsafeRegion> regions) {
        for (Expr part : parts) {
            walkExpr(part, symbols, regions);
        }
    }

    private void walkExpr(Expr expr, FileSymbols symbols, List<UnsafeRegion> regions) {
        if (expr instanceof Leaf) {
            return;
        }
        if (expr instanceof UnsafeBlock unsafe) {
            regions.add(classify(unsafe.keyword().line(), RegionForm.BLOCK, unsafe.block(), symbols));
            walkBlock(unsafe.block(), symbols, regions);
        } else if (expr instanceof BlockExpr block) {
            walkBlock(block.block(), symbols, regions);
        } else if (expr instanceof Group group) {
            walkExprs(group.parts(), symbols, regions);
        } else if (expr instanceof MacroCall call) {
            walkExprs(call.arguments().parts(), symbols, regions);
        } else if (expr instanceof ControlFlow flow) {
            walkExprs(flow.header(), symbols, regions);
            for (Block block : flow.blocks()) {
                walkBlock(block, symbols, regions);
            }
            if (flow.elseIf() != null) {
                walkExpr(flow.elseIf(), symbols, regions);
            }
        } else {
            throw new IllegalStateException("Unhandled expression: " + expr);
        }
    }

    // ==================== Classification ====================

    private UnsafeRegion classify(int line, RegionForm form, Block body, FileSymbols symbols) {
        List<Token> tokens = body.tokens();
        for (RiskHeuristic heuristic : heuristics) {
            if (heuristic.matches(tokens, symbols)) {
                return new UnsafeRegion(line, form, heuristic.kind(), heuristic.confidence(),
                        heuristic.remediation(), body.statements().size());
            }
        }
        RiskHeuristic fallback = RiskHeuristic.UNCLASSIFIED;
        return new UnsafeRegion(line, form, fallback.kind(), fallback.confidence(), fallback.remediation(),
                body.statements().size());
    }
}
