package im.arun.linktree.tree;

import im.arun.linktree.config.ConfigLoader;
import im.arun.linktree.config.LinkTreeConfig;
import im.arun.linktree.model.EngineWarning;
import im.arun.linktree.model.KeywordForest;
import im.arun.linktree.model.KeywordNode;
import im.arun.linktree.model.TreeSource;
import im.arun.linktree.model.WarningType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.HashSet;
import java.util.Locale;
import java.util.Set;

/**
 * Parses indentation-delimited keyword text into a forest of keyword nodes.
 *
 * <p>Each non-blank line is one keyword; its depth is the leading indent divided by the
 * indent unit, rounded down. A line may go at most one level deeper than the line before it;
 * deeper jumps are clamped instead of rejected, since the sources are edited by hand.
 */
public class KeywordTreeParser {
    private static final Logger logger = LoggerFactory.getLogger(KeywordTreeParser.class);
    private static final char BOM = '\uFEFF';

    private final int indentUnit;
    private final String pathSeparator;

    /**
     * @throws IllegalArgumentException if the indent unit is below 1 or the path separator is empty
     */
    public KeywordTreeParser(LinkTreeConfig config) {
        ConfigLoader.validate(config);
        this.indentUnit = config.getIndentUnit();
        this.pathSeparator = config.getPathSeparator();
    }

    public KeywordForest parse(String treeText) {
        return parse(treeText, null);
    }

    /**
     * Parse the primary tree and the "other keywords" tree into one forest.
     * Roots of the second text follow the roots of the first; the two are not linked.
     *
     * @param treeText          primary tree text, may be null
     * @param otherKeywordsText secondary tree text, may be null
     * @return forest holding both trees plus any indentation warnings
     */
    public KeywordForest parse(String treeText, String otherKeywordsText) {
        KeywordForest forest = new KeywordForest();
        Set<String> usedIds = new HashSet<>();

        parseInto(forest, treeText, TreeSource.PRIMARY, usedIds);
        parseInto(forest, otherKeywordsText, TreeSource.OTHER, usedIds);

        logger.info("Parsed keyword forest: {} roots, {} nodes, {} warnings",
            forest.getRoots().size(), usedIds.size(), forest.getWarnings().size());
        return forest;
    }

    private void parseInto(KeywordForest forest, String text, TreeSource source, Set<String> usedIds) {
        if (text == null || text.isEmpty()) {
            return;
        }
        if (text.charAt(0) == BOM) {
            text = text.substring(1);
        }

        // Open ancestors of the next line; depths along the stack are consecutive
        Deque<KeywordNode> stack = new ArrayDeque<>();
        int previousDepth = -1;
        String[] lines = text.split("\\R", -1);

        for (int i = 0; i < lines.length; i++) {
            String line = lines[i];
            if (line.isBlank()) {
                continue;
            }

            int lineNumber = i + 1;
            String subject = source.name().toLowerCase(Locale.ROOT) + ":" + lineNumber;
            int width = indentWidth(line);
            int depth = width / indentUnit;

            if (width % indentUnit != 0) {
                addWarning(forest, EngineWarning.of(WarningType.INDENT_MISALIGNED, subject,
                    "Indent of %d is not a multiple of %d; using depth %d", width, indentUnit, depth));
            }
            if (depth > previousDepth + 1) {
                addWarning(forest, EngineWarning.of(WarningType.INDENT_CLAMPED, subject,
                    "Depth %d follows depth %d; clamped to %d", depth, previousDepth, previousDepth + 1));
                depth = previousDepth + 1;
            }

            KeywordNode node = new KeywordNode(line.strip(), depth, lineNumber, source);

            while (!stack.isEmpty() && stack.peek().getDepth() >= depth) {
                stack.pop();
            }
            if (stack.isEmpty()) {
                forest.getRoots().add(node);
            } else {
                stack.peek().addChild(node);
            }
            node.setId(assignId(node, usedIds, forest, subject));

            logger.debug("{} -> {} (depth {})", subject, node.getId(), depth);
            stack.push(node);
            previousDepth = depth;
        }
    }

    /**
     * Leading whitespace width in columns; a tab counts as one indent unit.
     */
    private int indentWidth(String line) {
        int width = 0;
        for (int i = 0; i < line.length(); i++) {
            char c = line.charAt(i);
            if (c == '\t') {
                width += indentUnit;
            } else if (Character.isWhitespace(c) || Character.isSpaceChar(c)) {
                width++;
            } else {
                break;
            }
        }
        return width;
    }

    private String assignId(KeywordNode node, Set<String> usedIds, KeywordForest forest, String subject) {
        KeywordNode parent = node.getParent();
        String base = parent == null
            ? node.getKeyword()
            : parent.getId() + pathSeparator + node.getKeyword();

        String id = base;
        int occurrence = 2;
        while (usedIds.contains(id)) {
            id = base + "#" + occurrence++;
        }
        if (!id.equals(base)) {
            addWarning(forest, EngineWarning.of(WarningType.DUPLICATE_NODE_ID, subject,
                "Path %s already exists; node id is %s", base, id));
        }
        usedIds.add(id);
        return id;
    }

    private void addWarning(KeywordForest forest, EngineWarning warning) {
        logger.warn("{} at {}: {}", warning.getType(), warning.getSubject(), warning.getMessage());
        forest.getWarnings().add(warning);
    }
}
