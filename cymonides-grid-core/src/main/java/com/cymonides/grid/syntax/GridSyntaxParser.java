package com.cymonides.grid.syntax;

import com.cymonides.grid.model.NodeClass;
import org.jboss.logging.Logger;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Parses grid commands such as {@code /gridS{@person ##category:finance 2-4A} => +#flagged}.
 * <p>
 * The command is split once on the first {@code =>}: the left side is the selection, the
 * right side one or more {@code =>}-separated actions. The selection is tokenized on
 * whitespace and commas and every token is classified on its own; tokens that match no
 * rule are dropped. Parsing never throws: input that is not grid syntax comes back with
 * {@code gridMode == false}.
 */
public class GridSyntaxParser {

    private static final Logger LOG = Logger.getLogger(GridSyntaxParser.class);

    private static final String ACTION_SEPARATOR = "=>";

    private static final Pattern GRID_PREFIX =
            Pattern.compile("^/grid([A-Za-z])(?:\\{([^}]*)\\})?(.*)$", Pattern.DOTALL);
    private static final Pattern TAG_ADD = Pattern.compile("^\\+#([A-Za-z0-9_:-]+)");
    private static final Pattern TAG_REMOVE = Pattern.compile("^-#([A-Za-z0-9_:-]+)");
    private static final Pattern WATCHER = Pattern.compile(
            "^\\+?(?:#?watcher|w)([A-Za-z])?(?:\\{([^}]+)\\}|\\[([^\\]]+)\\])",
            Pattern.CASE_INSENSITIVE);
    private static final Pattern TOKEN_SEPARATOR = Pattern.compile("[\\s,]+");

    public GridSyntaxParsed parse(String input) {
        String text = input == null ? "" : input.trim();
        if (text.isEmpty() || hasUnmatchedBrace(text)) {
            return GridSyntaxParsed.notGrid(text);
        }
        try {
            return parseCommand(text);
        } catch (RuntimeException e) {
            LOG.warnf(e, "Unable to parse grid command '%s', treating it as plain text", text);
            return GridSyntaxParsed.notGrid(text);
        }
    }

    private GridSyntaxParsed parseCommand(String text) {
        String selection = text;
        String actionText = "";
        int sep = text.indexOf(ACTION_SEPARATOR);
        if (sep >= 0) {
            selection = text.substring(0, sep).trim();
            actionText = text.substring(sep + ACTION_SEPARATOR.length()).trim();
        }

        NodeClass rotation = null;
        boolean gridMode;
        Matcher grid = GRID_PREFIX.matcher(selection);
        if (grid.matches()) {
            gridMode = true;
            rotation = GridVocabulary.rotation(grid.group(1).charAt(0)).orElse(null);
            String body = grid.group(2) == null ? "" : grid.group(2).trim();
            String tail = grid.group(3) == null ? "" : grid.group(3).trim();
            selection = (body + " " + tail).trim();
        } else if (selection.startsWith("#:")) {
            gridMode = true;
            selection = selection.substring(2).trim();
        } else {
            gridMode = selection.startsWith("#") || selection.startsWith("@");
        }
        if (!gridMode) {
            return GridSyntaxParsed.notGrid(text);
        }

        List<GridAction> actions = new ArrayList<>();
        for (String segment : actionText.split(ACTION_SEPARATOR)) {
            parseAction(segment.trim()).ifPresent(actions::add);
        }

        NodeClass classFilter = null;
        String typeFilter = null;
        String booleanOp = null;
        List<String> nodeRefs = new ArrayList<>();
        List<FilterClause> filters = new ArrayList<>();
        List<CellReference> cellRefs = new ArrayList<>();

        for (String token : TOKEN_SEPARATOR.split(selection)) {
            if (token.isEmpty()) {
                continue;
            }
            Optional<CellReference> cell = CellReference.parse(token);
            if (cell.isPresent()) {
                cellRefs.add(cell.get());
                continue;
            }
            String upper = token.toUpperCase(Locale.ROOT);
            if ("AND".equals(upper) || "OR".equals(upper)) {
                booleanOp = upper;
                continue;
            }
            Optional<NodeClass> cls = GridVocabulary.classAlias(token);
            if (cls.isPresent()) {
                classFilter = cls.get();
                continue;
            }
            Optional<String> type = GridVocabulary.typeAlias(token);
            if (type.isPresent()) {
                typeFilter = type.get();
                continue;
            }
            if (token.startsWith("##")) {
                parseFilter(token).ifPresent(filters::add);
                continue;
            }
            if (token.startsWith("#")) {
                String id = token.substring(1);
                if (!id.isEmpty()) {
                    nodeRefs.add(id);
                }
                continue;
            }
            if (token.indexOf(':') >= 0) {
                parseFilter(token).ifPresent(filters::add);
                continue;
            }
            LOG.tracef("Dropping unrecognized grid token '%s'", token);
        }

        return new GridSyntaxParsed(text, true, rotation, classFilter, typeFilter, nodeRefs,
                booleanOp, filters, cellRefs, actions);
    }

    Optional<GridAction> parseAction(String action) {
        if (action.isEmpty()) {
            return Optional.empty();
        }
        // watcher first so that "+#watcher{...}" is not read as a tag
        Matcher m = WATCHER.matcher(action);
        if (m.find()) {
            String header = m.group(2) != null ? m.group(2) : m.group(3);
            String label = header == null ? "" : header.trim();
            if (label.isEmpty()) {
                return Optional.empty();
            }
            String hint = m.group(1) == null ? null
                    : GridVocabulary.watcherTypeHint(m.group(1).charAt(0)).orElse(null);
            return Optional.of(GridAction.watcher(label, hint, action));
        }
        m = TAG_ADD.matcher(action);
        if (m.find()) {
            return Optional.of(GridAction.tagAdd(m.group(1), action));
        }
        m = TAG_REMOVE.matcher(action);
        if (m.find()) {
            return Optional.of(GridAction.tagRemove(m.group(1), action));
        }
        return Optional.of(GridAction.unrecognized(action));
    }

    static Optional<FilterClause> parseFilter(String token) {
        String raw = token.trim();
        int start = 0;
        while (start < raw.length() && raw.charAt(start) == '#') {
            start++;
        }
        String body = raw.substring(start).trim();
        if (body.isEmpty()) {
            return Optional.empty();
        }
        int colon = body.indexOf(':');
        String dimension = colon >= 0 ? body.substring(0, colon).trim() : body;
        String value = colon >= 0 ? body.substring(colon + 1).trim() : "";
        if (dimension.isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(FilterClause.of(dimension, value, raw));
    }

    static boolean hasUnmatchedBrace(String text) {
        int depth = 0;
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            if (c == '{') {
                depth++;
            } else if (c == '}' && depth > 0) {
                depth--;
            }
        }
        return depth > 0;
    }
}
