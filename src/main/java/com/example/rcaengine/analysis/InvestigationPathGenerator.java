package com.example.rcaengine.analysis;

import com.example.rcaengine.config.EngineProperties;
import com.example.rcaengine.memory.BoundedLookup;
import com.example.rcaengine.memory.DiagnosticContentProvider;
import com.example.rcaengine.memory.HistoricalOutcomeProvider;
import com.example.rcaengine.model.CandidateScore;
import com.example.rcaengine.model.DiagnosticCheck;
import com.example.rcaengine.model.InvestigationPath;
import com.example.rcaengine.model.InvestigationStep;
import com.example.rcaengine.model.RootCauseHypothesis;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;

/**
 * Turns a hypothesis into ordered investigation steps. Probabilities are
 * the candidate scores normalized to sum to 1; checks and past fixes come
 * from collaborators and fall back to empty lists. Every lookup of one
 * path is started up front, so a slow collaborator costs one timeout.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class InvestigationPathGenerator {

    private final EngineProperties properties;
    private final DiagnosticContentProvider diagnosticContent;
    private final HistoricalOutcomeProvider historicalOutcomes;
    private final BoundedLookup boundedLookup;

    public InvestigationPath generate(String incidentId, RootCauseHypothesis hypothesis) {
        if (hypothesis == null || hypothesis.getCandidates().isEmpty()) {
            return InvestigationPath.empty(incidentId, hypothesis != null ? hypothesis.getRevision() : 0);
        }

        List<CandidateScore> ranked = hypothesis.getCandidates().stream()
                .sorted(RootCauseScorer.RANKING)
                .limit(properties.getInvestigation().getMaxSteps())
                .toList();
        double total = hypothesis.getCandidates().stream().mapToDouble(CandidateScore::score).sum();

        List<BoundedLookup.PendingLookup<List<DiagnosticCheck>>> checks = new ArrayList<>();
        List<BoundedLookup.PendingLookup<List<String>>> fixes = new ArrayList<>();
        for (CandidateScore candidate : ranked) {
            checks.add(boundedLookup.start("diagnostic checks " + candidate.componentId(),
                    () -> diagnosticContent.getChecks(candidate.componentId(), candidate.alertPattern()),
                    List.<DiagnosticCheck>of()));
            fixes.add(boundedLookup.start("fix references " + candidate.componentId(),
                    () -> historicalOutcomes.getFixReferences(candidate.componentId(), candidate.alertPattern()),
                    List.<String>of()));
        }
        long checksDeadline = BoundedLookup.deadlineAfter(properties.getLookup().getDiagnosticTimeoutMs());
        long fixesDeadline = BoundedLookup.deadlineAfter(properties.getLookup().getHistoricalTimeoutMs());

        List<InvestigationStep> steps = new ArrayList<>();
        for (int i = 0; i < ranked.size(); i++) {
            CandidateScore candidate = ranked.get(i);
            double probability = total > 0
                    ? candidate.score() / total
                    : 1.0 / hypothesis.getCandidates().size();
            steps.add(new InvestigationStep(i + 1, candidate.componentId(), RootCauseScorer.round(probability),
                    checks.get(i).await(checksDeadline).value(), fixes.get(i).await(fixesDeadline).value()));
        }
        return new InvestigationPath(incidentId, hypothesis.getRevision(), steps);
    }
}
