package com.crossbot.scenario.action;

import com.crossbot.scenario.tree.ScenarioAction;
import com.crossbot.scenario.tree.SymbolRef;
import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;
import java.util.Objects;
import java.util.function.UnaryOperator;

/** CSV export of collected answers; the scenario then continues at {@code continuation}. */
public final class CsvConfig implements ActionConfig {

    private final String fileName;
    private final List<CsvColumn> columns;
    private final SymbolRef continuation;

    @JsonCreator
    public CsvConfig(
            @JsonProperty("fileName") String fileName,
            @JsonProperty("columns") List<CsvColumn> columns,
            @JsonProperty("continuation") SymbolRef continuation) {
        this.fileName = fileName;
        this.columns = columns != null ? List.copyOf(columns) : List.of();
        this.continuation = continuation;
    }

    public String getFileName() {
        return fileName;
    }

    public List<CsvColumn> getColumns() {
        return columns;
    }

    public SymbolRef getContinuation() {
        return continuation;
    }

    @Override
    public ScenarioAction action() {
        return ScenarioAction.CSV;
    }

    @Override
    public List<SymbolRef> references() {
        return continuation != null ? List.of(continuation) : List.of();
    }

    @Override
    public ActionConfig mapReferences(UnaryOperator<SymbolRef> mapper) {
        return new CsvConfig(fileName, columns, ActionConfig.map(continuation, mapper));
    }

    @Override
    public boolean equals(Object o) {
        if (!(o instanceof CsvConfig)) return false;
        CsvConfig that = (CsvConfig) o;
        return Objects.equals(fileName, that.fileName) && columns.equals(that.columns)
                && Objects.equals(continuation, that.continuation);
    }

    @Override
    public int hashCode() {
        return Objects.hash(fileName, columns, continuation);
    }
}
