package com.goerdes.cfrecovery.components;

import com.goerdes.cfrecovery.model.ArchitectureInfo;
import com.goerdes.cfrecovery.model.Statement;
import com.goerdes.cfrecovery.services.Analysis;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Factory that builds {@link Analysis} instances either from statements
 * produced by a disassembler or from a textual function listing.
 */
@Component
@RequiredArgsConstructor
public class AnalysisFactory {

    private final CfgBuilder cfgBuilder;

    private final StatementParser statementParser;

    public Analysis create(List<Statement> statements, ArchitectureInfo architecture) {
        return new Analysis(statements, architecture, cfgBuilder);
    }

    /**
     * Builds the analysis of a function given as text, see {@link StatementParser}
     * for the expected format.
     *
     * @param function     the listing, first line being the function header
     * @param architecture architecture of the binary
     * @return the analysis with its control flow graph built
     */
    public Analysis create(String function, ArchitectureInfo architecture) {
        return create(statementParser.parse(function), architecture);
    }
}
