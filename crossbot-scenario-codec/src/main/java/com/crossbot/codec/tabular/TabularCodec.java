package com.crossbot.codec.tabular;

import com.crossbot.graph.ScenarioFormatException;
import com.crossbot.scenario.action.ActionConfig;
import com.crossbot.scenario.action.FormConfig;
import com.crossbot.scenario.action.HandoverConfig;
import com.crossbot.scenario.action.LinkConfig;
import com.crossbot.scenario.compile.ClassifierVocabulary;
import com.crossbot.scenario.compile.CompilationResult;
import com.crossbot.scenario.compile.CompileDiagnostic;
import com.crossbot.scenario.compile.DiagnosticKind;
import com.crossbot.scenario.tree.BranchCondition;
import com.crossbot.scenario.tree.CompiledNode;
import com.crossbot.scenario.tree.CompiledScenario;
import com.crossbot.scenario.tree.ResponseBlock;
import com.fasterxml.jackson.databind.MappingIterator;
import com.fasterxml.jackson.databind.SequenceWriter;
import com.fasterxml.jackson.dataformat.csv.CsvGenerator;
import com.fasterxml.jackson.dataformat.csv.CsvMapper;
import com.fasterxml.jackson.dataformat.csv.CsvParser;
import com.fasterxml.jackson.dataformat.csv.CsvSchema;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.StringWriter;
import java.io.UncheckedIOException;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Imports and exports the spreadsheet form of a scenario: one row per root-to-leaf path, columns
 * {@code Level1..Level10} plus {@code TransitionCount}.
 * <p>
 * Import deduplicates (parent, cell) so rows sharing a prefix share their ancestors. Export writes one
 * row per leaf with every cell quoted; paths deeper than ten levels are handled by the
 * {@link DepthOverflowPolicy}.
 */
public final class TabularCodec {

    private static final Logger log = LoggerFactory.getLogger(TabularCodec.class);

    public static final int MAX_LEVELS = 10;
    public static final String LEVEL_COLUMN_PREFIX = "Level";
    public static final String TRANSITION_COUNT_COLUMN = "TransitionCount";

    static final String LINK_RESPONSE_SUFFIX = "の詳細については、以下のリンクをご確認ください。";
    static final String HANDOVER_RESPONSE = "担当者にお繋ぎします。少々お待ちください。";
    static final String FORM_RESPONSE = "こちらのフォームに必要事項をご入力ください。";

    private static final char BOM = '\uFEFF';

    private static final CsvMapper MAPPER = CsvMapper.builder()
            .enable(CsvParser.Feature.WRAP_AS_ARRAY)
            .enable(CsvParser.Feature.SKIP_EMPTY_LINES)
            .enable(CsvParser.Feature.TRIM_SPACES)
            .enable(CsvGenerator.Feature.ALWAYS_QUOTE_STRINGS)
            .enable(CsvGenerator.Feature.ALWAYS_QUOTE_EMPTY_STRINGS)
            .build();

    private final ClassifierVocabulary vocabulary;
    private final DepthOverflowPolicy overflowPolicy;

    public TabularCodec(ClassifierVocabulary vocabulary, DepthOverflowPolicy overflowPolicy) {
        this.vocabulary = Objects.requireNonNull(vocabulary, "vocabulary");
        this.overflowPolicy = overflowPolicy != null ? overflowPolicy : DepthOverflowPolicy.REJECT;
    }

    public static TabularCodec withDefaults() {
        return new TabularCodec(ClassifierVocabulary.defaults(), DepthOverflowPolicy.REJECT);
    }

    public DepthOverflowPolicy getOverflowPolicy() {
        return overflowPolicy;
    }

    /**
     * Builds a scenario from CSV text.
     *
     * @throws ScenarioFormatException when the text cannot be read as CSV or has no level header
     */
    public CompilationResult importCsv(String csv) {
        if (csv == null || csv.isBlank()) {
            throw new ScenarioFormatException("Tabular document is empty");
        }
        List<String[]> rows = readRows(csv.charAt(0) == BOM ? csv.substring(1) : csv);
        if (rows.isEmpty()) {
            throw new ScenarioFormatException("Tabular document has no header row");
        }
        int[] levelColumns = levelColumns(rows.get(0));

        List<Draft> drafts = new ArrayList<>();
        List<Integer> roots = new ArrayList<>();
        Map<String, Integer> keys = new HashMap<>();
        for (int r = 1; r < rows.size(); r++) {
            String[] row = rows.get(r);
            Integer parent = null;
            for (int column : levelColumns) {
                if (column < 0 || column >= row.length || row[column] == null || row[column].isBlank()) continue;
                TabularCell cell = TabularCell.parse(row[column].trim(), vocabulary);
                // Siblings are identified by label; the first cell decides the action.
                String key = (parent != null ? parent : "") + "\u0000" + cell.getText();
                Integer existing = keys.get(key);
                if (existing != null && drafts.get(existing).cell.getAction() != cell.getAction()) {
                    log.debug("TabularCodec | conflicting action marker ignored | row={} | label={} | kept={}",
                            r + 1, cell.getText(), drafts.get(existing).cell.getAction());
                }
                if (existing == null) {
                    List<Integer> siblings = parent != null ? drafts.get(parent).children : roots;
                    Draft draft = newDraft(drafts.size(), parent, parent != null ? drafts.get(parent).level + 1 : 0,
                            siblings.size(), cell);
                    drafts.add(draft);
                    siblings.add(draft.id);
                    keys.put(key, draft.id);
                    existing = draft.id;
                }
                parent = existing;
            }
            if (parent == null) {
                log.debug("TabularCodec | row without level cells | row={}", r + 1);
            }
        }

        List<CompiledNode> nodes = new ArrayList<>(drafts.size());
        for (Draft d : drafts) {
            nodes.add(new CompiledNode(d.id, null, d.level, d.order, null, d.cell.getText(), d.responses,
                    d.cell.getAction(), d.config, BranchCondition.NONE, d.parent, d.children));
        }
        if (log.isInfoEnabled()) {
            log.info("TabularCodec | imported | rows={} | nodes={} | roots={}", rows.size() - 1, nodes.size(), roots.size());
        }
        return new CompilationResult(new CompiledScenario(nodes, roots), List.of());
    }

    /**
     * Writes one row per leaf.
     *
     * @throws TabularDepthException when a path is deeper than {@link #MAX_LEVELS} and the policy is REJECT
     */
    public TabularExport export(CompiledScenario scenario) {
        Set<List<String>> paths = new LinkedHashSet<>();
        int[] truncated = {0};
        for (CompiledNode root : scenario.roots()) {
            collectPaths(scenario, root, new ArrayList<>(), paths, truncated);
        }

        List<String[]> rows = new ArrayList<>(paths.size() + 1);
        rows.add(header());
        for (List<String> path : paths) {
            String[] row = new String[MAX_LEVELS + 1];
            for (int i = 0; i <= MAX_LEVELS; i++) {
                row[i] = i < path.size() ? path.get(i) : "";
            }
            rows.add(row);
        }

        List<CompileDiagnostic> diagnostics = new ArrayList<>();
        if (truncated[0] > 0) {
            diagnostics.add(CompileDiagnostic.of(DiagnosticKind.TRUNCATED_ROW, null,
                    truncated[0] + " row(s) deeper than " + MAX_LEVELS + " levels were truncated"));
            log.warn("TabularCodec | truncated rows | count={}", truncated[0]);
        }
        if (log.isInfoEnabled()) {
            log.info("TabularCodec | exported | nodes={} | rows={}", scenario.size(), paths.size());
        }
        return new TabularExport(writeRows(rows), paths.size(), diagnostics);
    }

    /** Same as {@link #export} without the diagnostics. */
    public String exportCsv(CompiledScenario scenario) {
        return export(scenario).getCsv();
    }

    private void collectPaths(CompiledScenario scenario, CompiledNode node, List<String> path,
                              Set<List<String>> into, int[] truncated) {
        path.add(TabularCell.format(node, vocabulary));
        if (node.isLeaf()) {
            if (path.size() <= MAX_LEVELS) {
                into.add(List.copyOf(path));
            } else if (overflowPolicy == DepthOverflowPolicy.REJECT) {
                throw new TabularDepthException(path, MAX_LEVELS);
            } else {
                truncated[0]++;
                into.add(List.copyOf(path.subList(0, MAX_LEVELS)));
            }
        } else {
            for (CompiledNode child : scenario.children(node.getId())) {
                collectPaths(scenario, child, path, into, truncated);
            }
        }
        path.remove(path.size() - 1);
    }

    private Draft newDraft(int id, Integer parent, int level, int order, TabularCell cell) {
        List<ResponseBlock> responses = new ArrayList<>(1);
        ActionConfig config = null;
        switch (cell.getAction()) {
            case LINK -> {
                config = new LinkConfig(cell.getArgument());
                responses.add(ResponseBlock.text(cell.getText() + LINK_RESPONSE_SUFFIX));
            }
            case HANDOVER -> {
                config = new HandoverConfig(null, null);
                responses.add(ResponseBlock.text(HANDOVER_RESPONSE));
            }
            case FORM -> {
                config = new FormConfig(cell.getArgument(), List.of());
                responses.add(ResponseBlock.text(FORM_RESPONSE));
            }
            default -> {
            }
        }
        return new Draft(id, parent, level, order, cell, responses, config);
    }

    private static int[] levelColumns(String[] header) {
        int[] columns = new int[MAX_LEVELS];
        Arrays.fill(columns, -1);
        for (int c = 0; c < header.length; c++) {
            String name = header[c] != null ? header[c].trim() : "";
            if (c == 0 && !name.isEmpty() && name.charAt(0) == BOM) name = name.substring(1);
            for (int level = 1; level <= MAX_LEVELS; level++) {
                if (name.equalsIgnoreCase(LEVEL_COLUMN_PREFIX + level)) columns[level - 1] = c;
            }
        }
        if (columns[0] < 0) {
            throw new ScenarioFormatException("Tabular header has no " + LEVEL_COLUMN_PREFIX + "1 column");
        }
        return columns;
    }

    private static String[] header() {
        String[] header = new String[MAX_LEVELS + 1];
        for (int level = 1; level <= MAX_LEVELS; level++) {
            header[level - 1] = LEVEL_COLUMN_PREFIX + level;
        }
        header[MAX_LEVELS] = TRANSITION_COUNT_COLUMN;
        return header;
    }

    private static List<String[]> readRows(String csv) {
        try (MappingIterator<String[]> it = MAPPER.readerFor(String[].class)
                .with(CsvSchema.emptySchema())
                .readValues(csv)) {
            return it.readAll();
        } catch (IOException | RuntimeException e) {
            throw new ScenarioFormatException("Tabular document is not valid CSV: " + e.getMessage(), e);
        }
    }

    private static String writeRows(List<String[]> rows) {
        StringWriter out = new StringWriter();
        try (SequenceWriter writer = MAPPER.writer(CsvSchema.emptySchema().withLineSeparator("\n")).writeValues(out)) {
            for (String[] row : rows) {
                writer.write(row);
            }
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
        return out.toString();
    }

    private static final class Draft {
        final int id;
        final Integer parent;
        final int level;
        final int order;
        final TabularCell cell;
        final List<ResponseBlock> responses;
        final ActionConfig config;
        final List<Integer> children = new ArrayList<>();

        Draft(int id, Integer parent, int level, int order, TabularCell cell, List<ResponseBlock> responses,
              ActionConfig config) {
            this.id = id;
            this.parent = parent;
            this.level = level;
            this.order = order;
            this.cell = cell;
            this.responses = responses;
            this.config = config;
        }
    }
}
