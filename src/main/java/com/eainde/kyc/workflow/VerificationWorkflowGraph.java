package com.eainde.kyc.workflow;

import com.eainde.kyc.edges.AuditRoutingEdge;
import com.eainde.kyc.edges.ValidationRoutingEdge;
import com.eainde.kyc.nodes.AppendAuditNode;
import com.eainde.kyc.nodes.ClassifyRiskNode;
import com.eainde.kyc.nodes.CompleteVerificationNode;
import com.eainde.kyc.nodes.ExtractFeaturesNode;
import com.eainde.kyc.nodes.ScoreFeaturesNode;
import com.eainde.kyc.nodes.ValidateRecordNode;
import com.eainde.kyc.state.VerificationState;
import org.bsc.langgraph4j.CompiledGraph;
import org.bsc.langgraph4j.GraphStateException;
import org.bsc.langgraph4j.StateGraph;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.Map;

import static org.bsc.langgraph4j.StateGraph.END;
import static org.bsc.langgraph4j.StateGraph.START;

/**
 * Single-record verification as a state graph.
 *
 * <pre>
 * START -> validate_record --rejected--> END
 *                          --accepted--> extract_features -> score_features -> classify_risk
 *       -> append_audit --failed--> END
 *                       --logged--> complete_verification -> END
 * </pre>
 */
@Configuration
public class VerificationWorkflowGraph {

    static final String VALIDATE = "validate_record";
    static final String EXTRACT = "extract_features";
    static final String SCORE = "score_features";
    static final String CLASSIFY = "classify_risk";
    static final String AUDIT = "append_audit";
    static final String COMPLETE = "complete_verification";

    private final ValidateRecordNode validateNode;
    private final ExtractFeaturesNode extractNode;
    private final ScoreFeaturesNode scoreNode;
    private final ClassifyRiskNode classifyNode;
    private final AppendAuditNode auditNode;
    private final CompleteVerificationNode completeNode;
    private final ValidationRoutingEdge validationEdge;
    private final AuditRoutingEdge auditEdge;

    public VerificationWorkflowGraph(ValidateRecordNode validateNode,
                                     ExtractFeaturesNode extractNode,
                                     ScoreFeaturesNode scoreNode,
                                     ClassifyRiskNode classifyNode,
                                     AppendAuditNode auditNode,
                                     CompleteVerificationNode completeNode,
                                     ValidationRoutingEdge validationEdge,
                                     AuditRoutingEdge auditEdge) {
        this.validateNode = validateNode;
        this.extractNode = extractNode;
        this.scoreNode = scoreNode;
        this.classifyNode = classifyNode;
        this.auditNode = auditNode;
        this.completeNode = completeNode;
        this.validationEdge = validationEdge;
        this.auditEdge = auditEdge;
    }

    @Bean("verificationWorkflow")
    public CompiledGraph<VerificationState> build() throws GraphStateException {

        StateGraph<VerificationState> workflow = new StateGraph<>(VerificationState::new);

        workflow.addNode(VALIDATE, validateNode);
        workflow.addNode(EXTRACT, extractNode);
        workflow.addNode(SCORE, scoreNode);
        workflow.addNode(CLASSIFY, classifyNode);
        workflow.addNode(AUDIT, auditNode);
        workflow.addNode(COMPLETE, completeNode);

        workflow.addEdge(START, VALIDATE);
        workflow.addConditionalEdges(
                VALIDATE,
                validationEdge,
                Map.of(
                        ValidationRoutingEdge.ACCEPTED, EXTRACT,
                        ValidationRoutingEdge.REJECTED, END
                )
        );
        workflow.addEdge(EXTRACT, SCORE);
        workflow.addEdge(SCORE, CLASSIFY);
        workflow.addEdge(CLASSIFY, AUDIT);
        workflow.addConditionalEdges(
                AUDIT,
                auditEdge,
                Map.of(
                        AuditRoutingEdge.LOGGED, COMPLETE,
                        AuditRoutingEdge.FAILED, END
                )
        );
        workflow.addEdge(COMPLETE, END);

        return workflow.compile();
    }
}
