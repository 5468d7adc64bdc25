package com.goerdes.cfrecovery.services;

import com.goerdes.cfrecovery.components.AnalysisFactory;
import com.goerdes.cfrecovery.components.ArchitectureInfoCodec;
import com.goerdes.cfrecovery.components.StructureReducer;
import com.goerdes.cfrecovery.blocks.StructureGraph;
import com.goerdes.cfrecovery.model.ArchitectureInfo;
import com.goerdes.cfrecovery.model.Statement;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * Entry point of the control flow recovery: builds the control flow graph of
 * a function and, unless disabled, folds it into structured blocks.
 */
@Service
@RequiredArgsConstructor
public class AnalysisService {

    private static final Logger log = LoggerFactory.getLogger(AnalysisService.class);

    private final AnalysisFactory factory;
    private final StructureReducer reducer;
    private final ArchitectureInfoCodec codec;

    @Value("${analysis.structuring.enabled:true}")
    private boolean structuringEnabled;

    /**
     * Analyses a function given as statements.
     *
     * @param statements   the statements in program order
     * @param architecture architecture of the binary
     * @return the analysis, structured if structuring is enabled
     */
    public Analysis analyze(List<Statement> statements, ArchitectureInfo architecture) {
        log.info("Analyzing {} statements ({})", statements.size(), architecture.arch());
        return structure(factory.create(statements, architecture));
    }

    /**
     * Analyses a function given as textual listing.
     *
     * @param function     the listing, first line being the function header
     * @param architecture architecture of the binary
     * @return the analysis, structured if structuring is enabled
     */
    public Analysis analyze(String function, ArchitectureInfo architecture) {
        log.info("Analyzing function '{}' ({})", header(function), architecture.arch());
        return structure(factory.create(function, architecture));
    }

    /**
     * Analyses a function given as textual listing with the architecture
     * descriptor as JSON.
     *
     * @param function         the listing, first line being the function header
     * @param architectureJson the descriptor, see {@link ArchitectureInfoCodec}
     * @return the analysis, structured if structuring is enabled
     */
    public Analysis analyze(String function, String architectureJson) {
        return analyze(function, codec.read(architectureJson));
    }

    private Analysis structure(Analysis analysis) {
        if (!structuringEnabled || analysis.getControlFlowGraph().isEmpty()) {
            return analysis;
        }
        StructureGraph structure = reducer.reduce(analysis.getControlFlowGraph());
        analysis.applyStructure(structure);
        log.info("  → {} basic blocks, structured root {}{}", analysis.getControlFlowGraph().size(),
                structure.getRoot(), structure.isReduced() ? "" : " (partially reduced, " + structure.size() + " blocks left)");
        return analysis;
    }

    private static String header(String function) {
        int newline = function.indexOf('\n');
        return (newline < 0 ? function : function.substring(0, newline)).strip();
    }
}
