package com.missionforge.orchestrator;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import com.missionforge.config.VerificationSettings;
import com.missionforge.core.agent.AgentType;
import com.missionforge.core.agent.ArbiterAgent;
import com.missionforge.core.agent.ArbiterVerdict;
import com.missionforge.core.agent.MissionPlannerAgent;
import com.missionforge.core.agent.PromptContextFactory;
import com.missionforge.core.agent.PropertyAgent;
import com.missionforge.core.automaton.AcceptingRun;
import com.missionforge.core.automaton.AutomatonSampler;
import com.missionforge.core.checker.ModelChecker;
import com.missionforge.core.checker.VerifyResult;
import com.missionforge.core.compiler.CompiledProgram;
import com.missionforge.core.compiler.ModelCompiler;
import com.missionforge.core.error.ArbiterRejectionException;
import com.missionforge.core.error.FailureKind;
import com.missionforge.core.error.PropertyViolatedException;
import com.missionforge.core.error.SchemaViolationException;
import com.missionforge.core.error.ToolConfigurationException;
import com.missionforge.core.error.VerificationException;
import com.missionforge.core.filesystem.MissionWorkspace;
import com.missionforge.core.reconcile.PropertyReconciler;
import com.missionforge.core.schema.SchemaCatalog;
import com.missionforge.core.schema.SchemaValidator;
import com.missionforge.core.schema.ValidationResult;
import com.missionforge.core.state.Feedback;
import com.missionforge.core.state.VerificationSession;
import com.missionforge.core.state.VerificationState;
import com.missionforge.core.tree.BehaviorNode;
import com.missionforge.core.tree.MissionParser;
import com.missionforge.llm.Conversation;
import com.missionforge.orchestrator.dto.MissionResult;

import java.nio.file.Path;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.stream.Collectors;

/**
 * VerificationOrchestrator: drives one mission request through generation,
 * compilation and formal verification.
 *
 * Phase flow:  NEED_XML → NEED_LTL → NEED_RECONCILE → NEED_MODEL_CHECK
 *              → NEED_ARBITER → NEED_TRAIL_CHECK → DONE
 *
 * Blame on failure:
 *   NEED_XML                                   → mission planner, retry NEED_XML
 *   NEED_LTL / NEED_RECONCILE / NEED_MODEL_CHECK → property generator, retry NEED_LTL
 *   NEED_ARBITER  (rejection, sampling)          → property generator, retry NEED_LTL
 *   NEED_TRAIL_CHECK (counterexample)            → mission planner, retry NEED_XML
 *
 * All retries draw on one budget per session. Non-retryable failures and an
 * exhausted budget end the session in FAILED with the last diagnostic.
 */
@Component
public class VerificationOrchestrator {

    private static final Logger log = LoggerFactory.getLogger(VerificationOrchestrator.class);

    private final PromptContextFactory contextFactory;
    private final MissionPlannerAgent  planner;
    private final PropertyAgent        propertyAgent;
    private final ArbiterAgent         arbiter;
    private final SchemaCatalog        schemaCatalog;
    private final SchemaValidator      schemaValidator;
    private final MissionParser        parser;
    private final ModelCompiler        compiler;
    private final PropertyReconciler   reconciler;
    private final ModelChecker         modelChecker;
    private final AutomatonSampler     sampler;
    private final MissionWorkspace     workspace;
    private final VerificationSettings settings;

    public VerificationOrchestrator(
            PromptContextFactory contextFactory,
            MissionPlannerAgent  planner,
            PropertyAgent        propertyAgent,
            ArbiterAgent         arbiter,
            SchemaCatalog        schemaCatalog,
            SchemaValidator      schemaValidator,
            MissionParser        parser,
            ModelCompiler        compiler,
            PropertyReconciler   reconciler,
            ModelChecker         modelChecker,
            AutomatonSampler     sampler,
            MissionWorkspace     workspace,
            VerificationSettings settings
    ) {
        this.contextFactory  = contextFactory;
        this.planner         = planner;
        this.propertyAgent   = propertyAgent;
        this.arbiter         = arbiter;
        this.schemaCatalog   = schemaCatalog;
        this.schemaValidator = schemaValidator;
        this.parser          = parser;
        this.compiler        = compiler;
        this.reconciler      = reconciler;
        this.modelChecker    = modelChecker;
        this.sampler         = sampler;
        this.workspace       = workspace;
        this.settings        = settings;
    }

    // =========================================================================
    // MAIN ENTRY POINT
    // =========================================================================

    public MissionResult verify(String missionRequest) {

        String sessionId = UUID.randomUUID().toString();
        log.info("========== MISSION VERIFICATION START [{}] ==========", sessionId);
        long startTime = System.currentTimeMillis();

        VerificationSession session;
        try {
            session = openSession(sessionId, missionRequest);
        } catch (ToolConfigurationException e) {
            log.error("[Orchestrator] Cannot open session: {}", e.getMessage());
            return new MissionResult(sessionId, false, VerificationState.FAILED.name(), 0,
                    null, e.getMessage(), List.of());
        }

        try {
            run(session);
        } finally {
            session.resetConversations();
        }

        log.info("========== MISSION VERIFICATION END [{}] state={} retries={} ({} ms) ==========",
                sessionId, session.getState(), session.getRetryCount(),
                System.currentTimeMillis() - startTime);

        return toResult(session);
    }

    /**
     * Step the session until it reaches DONE or FAILED.
     */
    public VerificationSession run(VerificationSession session) {
        while (!session.getState().isTerminal()) {
            try {
                switch (session.getState()) {
                    case NEED_XML         -> generateMission(session);
                    case NEED_LTL         -> generateProperty(session);
                    case NEED_RECONCILE   -> reconcile(session);
                    case NEED_MODEL_CHECK -> modelCheck(session);
                    case NEED_ARBITER     -> arbitrate(session);
                    case NEED_TRAIL_CHECK -> checkTrail(session);
                    case DONE, FAILED     -> throw new IllegalStateException("Terminal state " + session.getState());
                }
            } catch (VerificationException e) {
                handleFailure(session, e);
            }
        }
        return session;
    }

    public VerificationSession openSession(String sessionId, String missionRequest)
            throws ToolConfigurationException {

        Path workDir;
        try {
            workDir = workspace.createSessionDirectory(sessionId);
        } catch (MissionWorkspace.WorkspaceException e) {
            throw new ToolConfigurationException(e.getMessage(), e);
        }

        Map<AgentType, Conversation> conversations = new EnumMap<>(AgentType.class);
        for (AgentType role : AgentType.values()) {
            conversations.put(role, contextFactory.create(role));
        }

        return new VerificationSession(sessionId, missionRequest, workDir, conversations);
    }

    // =========================================================================
    // PHASES
    // =========================================================================

    private void generateMission(VerificationSession session) throws VerificationException {
        session.setXmlValid(false);
        session.setLtlValid(false);
        session.setSchemaRef(null);

        String xml = planner.generateMission(
                session.conversation(AgentType.MISSION_PLANNER),
                session.getMissionRequest(),
                session.takeFeedback(AgentType.MISSION_PLANNER));
        session.setMissionXml(xml);

        if (settings.isLintXml()) {
            Path schema = schemaCatalog.select(xml);
            session.setSchemaRef(schema);
            ValidationResult validation = schemaValidator.validate(schema, xml);
            if (!validation.isValid()) {
                throw new SchemaViolationException(validation.getErrorText());
            }
        }

        BehaviorNode    tree    = parser.parse(xml);
        CompiledProgram program = compiler.compile(tree);
        session.setMissionTree(tree);
        session.setCompiledProgram(program);
        session.setXmlValid(true);

        // property history belongs to the previous mission
        session.resetConversation(AgentType.PROPERTY_GENERATOR);
        session.takeFeedback(AgentType.PROPERTY_GENERATOR);
        propertyAgent.primeWithModel(session.conversation(AgentType.PROPERTY_GENERATOR), program);

        session.setState(VerificationState.NEED_LTL);
    }

    private void generateProperty(VerificationSession session) throws VerificationException {
        session.setLtlValid(false);

        String property = propertyAgent.generateProperty(
                session.conversation(AgentType.PROPERTY_GENERATOR),
                session.getMissionRequest(),
                session.takeFeedback(AgentType.PROPERTY_GENERATOR));
        session.setPropertyText(property);
        session.setAutomaton(sampler.translate(property));
        session.setLtlValid(true);

        session.setState(VerificationState.NEED_RECONCILE);
    }

    private void reconcile(VerificationSession session) throws VerificationException {
        if (settings.isReconcile()) {
            reconciler.reconcile(session.getMissionTree(), session.getAutomaton());
        } else {
            log.debug("[Orchestrator] Reconciliation disabled");
        }
        session.setState(VerificationState.NEED_MODEL_CHECK);
    }

    private void modelCheck(VerificationSession session) throws VerificationException {
        VerifyResult result = modelChecker.verify(
                session.getCompiledProgram(),
                session.getPropertyText(),
                session.getWorkDirectory());
        session.setVerifyResult(result);
        log.info("[Orchestrator] Model check: {}", result);

        session.setState(VerificationState.NEED_ARBITER);
    }

    private void arbitrate(VerificationSession session) throws VerificationException {
        List<AcceptingRun> runs = sampler.sampleAcceptingRuns(session.getAutomaton(), settings.getSampleRuns());
        session.setSampledRuns(runs);

        ArbiterVerdict verdict = arbiter.judge(
                session.conversation(AgentType.ARBITER),
                session.getMissionRequest(),
                runs);
        if (!verdict.isAccepted()) {
            throw new ArbiterRejectionException(verdict.getRationale());
        }

        session.setState(VerificationState.NEED_TRAIL_CHECK);
    }

    private void checkTrail(VerificationSession session) throws VerificationException {
        VerifyResult result = session.getVerifyResult();
        if (result != null && !result.isOk()) {
            throw new PropertyViolatedException(result.getTrail());
        }

        try {
            session.setMissionPath(workspace.writeMission(session.getId(), session.getMissionXml()));
        } catch (MissionWorkspace.WorkspaceException e) {
            throw new ToolConfigurationException("Verified mission could not be written: " + e.getMessage(), e);
        }

        log.info("[Orchestrator] Mission verified; written to {}", session.getMissionPath());
        session.setState(VerificationState.DONE);
    }

    // =========================================================================
    // FAILURE ROUTING
    // =========================================================================

    private void handleFailure(VerificationSession session, VerificationException e) {
        VerificationState failedIn = session.getState();
        session.setLastDiagnostic(e.getMessage());

        if (!e.isRetryable()) {
            log.error("[Orchestrator] {} in {} is not recoverable: {}", e.getKind(), failedIn, e.getMessage());
            session.setState(VerificationState.FAILED);
            return;
        }

        if (session.getRetryCount() >= settings.getMaxRetries()) {
            log.error("[Orchestrator] Retry budget of {} spent; last failure {} in {}",
                    settings.getMaxRetries(), e.getKind(), failedIn);
            session.setState(VerificationState.FAILED);
            return;
        }

        session.incrementRetryCount();
        log.warn("[Orchestrator] {} in {} (retry {}/{}): {}", e.getKind(), failedIn,
                session.getRetryCount(), settings.getMaxRetries(), e.getMessage());

        switch (failedIn) {
            case NEED_XML -> retry(session, AgentType.MISSION_PLANNER, e, VerificationState.NEED_XML);

            case NEED_LTL, NEED_RECONCILE, NEED_MODEL_CHECK ->
                    retry(session, AgentType.PROPERTY_GENERATOR, e, VerificationState.NEED_LTL);

            case NEED_ARBITER -> {
                if (e.getKind() == FailureKind.GENERATION_FAILURE) {
                    // the arbiter call itself failed; ask again
                    session.setState(VerificationState.NEED_ARBITER);
                } else {
                    retry(session, AgentType.PROPERTY_GENERATOR, e, VerificationState.NEED_LTL);
                }
            }

            case NEED_TRAIL_CHECK -> {
                session.resetConversation(AgentType.PROPERTY_GENERATOR);
                retry(session, AgentType.MISSION_PLANNER, e, VerificationState.NEED_XML);
            }

            case DONE, FAILED -> throw new IllegalStateException("Failure reported in terminal state " + failedIn);
        }
    }

    private void retry(VerificationSession session, AgentType blamed, VerificationException e,
                       VerificationState next) {
        session.setFeedback(blamed, Feedback.of(e));
        session.setState(next);
    }

    private MissionResult toResult(VerificationSession session) {
        boolean success = session.getState() == VerificationState.DONE;
        return new MissionResult(
                session.getId(),
                success,
                session.getState().name(),
                session.getRetryCount(),
                session.getMissionPath() != null ? session.getMissionPath().toString() : null,
                success ? null : session.getLastDiagnostic(),
                session.getSampledRuns().stream()
                        .map(AcceptingRun::toString)
                        .collect(Collectors.toList())
        );
    }
}
