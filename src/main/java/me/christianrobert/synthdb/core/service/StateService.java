package me.christianrobert.synthdb.core.service;

import jakarta.enterprise.context.ApplicationScoped;
import me.christianrobert.synthdb.schema.model.TableMetadata;
import me.christianrobert.synthdb.synthesis.model.SynthesisResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * In-memory application state shared by the REST resources and jobs: the schema currently
 * loaded and the outcome of the last generation run.
 */
@ApplicationScoped
public class StateService {

    private static final Logger log = LoggerFactory.getLogger(StateService.class);

    private volatile List<TableMetadata> tableMetadata = new ArrayList<>();
    // Where the tables came from: a database URL or "description"
    private volatile String schemaSource;
    private volatile SynthesisResult synthesisResult;

    public List<TableMetadata> getTableMetadata() {
        return tableMetadata;
    }

    public void setTableMetadata(List<TableMetadata> tableMetadata, String schemaSource) {
        this.tableMetadata = List.copyOf(tableMetadata);
        this.schemaSource = schemaSource;
        log.info("Updated table metadata state: {} tables from {}", tableMetadata.size(), schemaSource);
    }

    public boolean hasTableMetadata() {
        return !tableMetadata.isEmpty();
    }

    public String getSchemaSource() {
        return schemaSource;
    }

    public SynthesisResult getSynthesisResult() {
        return synthesisResult;
    }

    public void setSynthesisResult(SynthesisResult synthesisResult) {
        this.synthesisResult = synthesisResult;
    }

    public void resetState() {
        log.info("Resetting all state to default values");
        this.tableMetadata = new ArrayList<>();
        this.schemaSource = null;
        this.synthesisResult = null;
    }
}
