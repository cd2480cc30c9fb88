package com.questrail.refraction.safety;

import com.questrail.refraction.api.EscalationReason;
import com.questrail.refraction.api.PatientTurn;
import com.questrail.refraction.api.Sentiment;
import com.questrail.refraction.observability.NullObservabilitySink;
import com.questrail.refraction.observability.RefractionObservabilitySink;
import com.questrail.refraction.observability.SafetyEvent;
import com.questrail.refraction.quality.ResponseQuality;
import com.questrail.refraction.time.SystemWallClock;
import com.questrail.refraction.time.WallClock;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Locale;
import java.util.Objects;

/**
 * SafetyMonitor
 * -----------------------------------------------------------------------------
 * Cross-cutting override authority for one examination session.
 *
 * <h2>Responsibilities</h2>
 * <ul>
 *   <li>{@link #screen(PatientTurn)}: runs before anything else looks at a
 *       turn and decides whether the turn is escalated, persona-locked or
 *       allowed through</li>
 *   <li>{@link #recordResponse(PatientTurn, ResponseQuality)}: adds a fatigue
 *       sample once the quality gate has judged the turn and returns the
 *       fatigue recommendation</li>
 *   <li>Keeps the incident log and the monotonic red-flag / persona counters</li>
 * </ul>
 *
 * <h2>Precedence</h2>
 * <pre>
 *   red flag  &gt;  hard-stop duration  &gt;  persona override  &gt;  quality verdict
 * </pre>
 * Only the winning condition is logged as an incident. Counters count every
 * flag observed, whether or not it won.
 *
 * <h2>Fatigue</h2>
 * Fatigue is a recommendation. It never produces an ESCALATE directive.
 * A FATIGUED sentiment on the current turn flags fatigue even before a full
 * window of samples exists.
 *
 * <h2>Threading</h2>
 * Not thread-safe; owned by a single session.
 */
public final class SafetyMonitor
{
    private final String sessionId;
    private final DurationPolicy durationPolicy;
    private final FatiguePolicy fatiguePolicy;
    private final WallClock clock;
    private final RefractionObservabilitySink observabilitySink;

    private final List<TurnSample> baseline = new ArrayList<>();
    private final Deque<TurnSample> recent = new ArrayDeque<>();
    private final List<SafetyIncident> incidents = new ArrayList<>();

    private int totalSamples;
    private double elapsedSeconds;
    private int redFlagCount;
    private int personaOverrideCount;
    private int turnCount;
    private DurationStatus durationStatus = DurationStatus.CONTINUE;
    private boolean fatigueFlagged;

    public SafetyMonitor(String sessionId,
                         DurationPolicy durationPolicy,
                         FatiguePolicy fatiguePolicy,
                         WallClock clock,
                         RefractionObservabilitySink observabilitySink) {
        this.sessionId = Objects.requireNonNull(sessionId, "sessionId");
        this.durationPolicy = Objects.requireNonNull(durationPolicy, "durationPolicy");
        this.fatiguePolicy = Objects.requireNonNull(fatiguePolicy, "fatiguePolicy");
        this.clock = Objects.requireNonNull(clock, "clock");
        this.observabilitySink = Objects.requireNonNullElse(observabilitySink, NullObservabilitySink.INSTANCE);
    }

    public SafetyMonitor(DurationPolicy durationPolicy, FatiguePolicy fatiguePolicy) {
        this("standalone", durationPolicy, fatiguePolicy, SystemWallClock.INSTANCE, null);
    }

    // ---------------------------------------------------------------------
    // Per-turn screening
    // ---------------------------------------------------------------------

    /**
     * Screens one turn and returns the directive the engine must follow.
     */
    public SafetyVerdict screen(PatientTurn turn) {
        Objects.requireNonNull(turn, "turn");

        turnCount++;
        elapsedSeconds = turn.elapsedSeconds();
        if (turn.redFlag()) {
            redFlagCount++;
        }
        if (turn.personaOverride()) {
            personaOverrideCount++;
        }

        DurationStatus duration = durationPolicy.classify(elapsedSeconds);
        adviseDuration(duration);

        if (turn.redFlag()) {
            logIncident(SafetyIncident.Kind.RED_FLAG, SafetyEvent.Type.RED_FLAG,
                    "Red flag reported by patient (intent " + turn.intent().tag() + ")");
            return SafetyVerdict.escalate(EscalationReason.RED_FLAG, duration);
        }

        if (duration == DurationStatus.HARD_STOP) {
            logIncident(SafetyIncident.Kind.HARD_STOP, SafetyEvent.Type.HARD_STOP,
                    String.format(Locale.ROOT, "Session exceeded %.0fs (elapsed %.0fs)",
                            durationPolicy.hardStopAtSeconds(), elapsedSeconds));
            return SafetyVerdict.escalate(EscalationReason.DURATION_EXCEEDED, duration);
        }

        if (turn.personaOverride()) {
            logIncident(SafetyIncident.Kind.PERSONA_OVERRIDE, SafetyEvent.Type.PERSONA_OVERRIDE,
                    "Persona override attempt; step locked");
            return SafetyVerdict.personaLock(duration);
        }

        return SafetyVerdict.proceed(duration);
    }

    // Advisories fire once, when the status first rises to a level.
    private void adviseDuration(DurationStatus duration) {
        if (!duration.isMoreSevereThan(durationStatus)) {
            return;
        }
        durationStatus = duration;

        SafetyEvent.Type type = switch (duration) {
            case OFFER_BREAK -> SafetyEvent.Type.OFFER_BREAK;
            case WARN_AND_COMPLETE -> SafetyEvent.Type.WARN_AND_COMPLETE;
            case CONTINUE, HARD_STOP -> null;
        };
        if (type != null) {
            observabilitySink.onSafetyEvent(new SafetyEvent(
                    clock.now(), sessionId, type, elapsedSeconds, "Duration advisory: " + duration.code()));
        }
    }

    // ---------------------------------------------------------------------
    // Fatigue
    // ---------------------------------------------------------------------

    /**
     * Records a judged turn as a fatigue sample and evaluates fatigue.
     *
     * @param quality the quality gate's verdict; only CLEAR counts as accurate
     */
    public FatigueAssessment recordResponse(PatientTurn turn, ResponseQuality quality) {
        Objects.requireNonNull(turn, "turn");
        Objects.requireNonNull(quality, "quality");

        TurnSample sample = new TurnSample(
                quality == ResponseQuality.CLEAR ? 1.0 : 0.0,
                turn.confidence(),
                turn.responseLatencySeconds());

        if (baseline.size() < fatiguePolicy.windowSize()) {
            baseline.add(sample);
        }
        recent.addLast(sample);
        if (recent.size() > fatiguePolicy.windowSize()) {
            recent.removeFirst();
        }
        totalSamples++;

        FatigueAssessment assessment = assessFatigue(turn.sentiment());
        if (assessment.fatigued() && !fatigueFlagged) {
            logIncident(SafetyIncident.Kind.FATIGUE, SafetyEvent.Type.FATIGUE, assessment.reason().orElseThrow());
        }
        fatigueFlagged = assessment.fatigued();
        return assessment;
    }

    /**
     * Evaluates fatigue over the samples recorded so far without adding one.
     */
    public FatigueAssessment assessFatigue(Sentiment currentSentiment) {
        double score = fatigueScore();

        if (totalSamples >= fatiguePolicy.windowSize()) {
            double accuracyDrop = mean(baseline, Metric.ACCURACY) - mean(recent, Metric.ACCURACY);
            if (accuracyDrop > fatiguePolicy.accuracyDrop()) {
                return FatigueAssessment.fatigued(
                        String.format(Locale.ROOT, "Accuracy degradation: %.0f%% decrease", accuracyDrop * 100), score);
            }

            double latency = mean(recent, Metric.LATENCY);
            if (latency > fatiguePolicy.latencySeconds()) {
                return FatigueAssessment.fatigued(
                        String.format(Locale.ROOT, "Excessive hesitation: %.1fs average pause", latency), score);
            }

            double confidenceDrop = mean(baseline, Metric.CONFIDENCE) - mean(recent, Metric.CONFIDENCE);
            if (confidenceDrop > fatiguePolicy.confidenceDrop()) {
                return FatigueAssessment.fatigued(
                        String.format(Locale.ROOT, "Confidence degradation: %.0f%% decrease", confidenceDrop * 100),
                        score);
            }
        }

        if (currentSentiment == Sentiment.FATIGUED) {
            return FatigueAssessment.fatigued("Patient reports fatigue", score);
        }
        return FatigueAssessment.rested(score);
    }

    /**
     * 0.4·(1 − accuracy) + 0.3·min(1, latency / 5) + 0.3·(1 − confidence) over
     * the recent window, clamped to [0, 1]; 0.0 before any sample.
     */
    public double fatigueScore() {
        if (recent.isEmpty()) {
            return 0.0;
        }
        double accuracyScore = 1.0 - mean(recent, Metric.ACCURACY);
        double hesitationScore = Math.min(1.0, mean(recent, Metric.LATENCY) / 5.0);
        double confidenceScore = 1.0 - mean(recent, Metric.CONFIDENCE);
        double score = accuracyScore * 0.4 + hesitationScore * 0.3 + confidenceScore * 0.3;
        return Math.min(1.0, Math.max(0.0, score));
    }

    private enum Metric { ACCURACY, CONFIDENCE, LATENCY }

    private static double mean(Iterable<TurnSample> samples, Metric metric) {
        double sum = 0.0;
        int n = 0;
        for (TurnSample s : samples) {
            sum += switch (metric) {
                case ACCURACY -> s.accuracy();
                case CONFIDENCE -> s.confidence();
                case LATENCY -> s.latencySeconds();
            };
            n++;
        }
        return n == 0 ? 0.0 : sum / n;
    }

    // ---------------------------------------------------------------------
    // Incidents and queries
    // ---------------------------------------------------------------------

    private void logIncident(SafetyIncident.Kind kind, SafetyEvent.Type eventType, String description) {
        SafetyIncident incident = SafetyIncident.of(clock.now(), kind, elapsedSeconds, description);
        incidents.add(incident);
        observabilitySink.onSafetyEvent(new SafetyEvent(
                incident.timestamp(), sessionId, eventType, elapsedSeconds, description));
    }

    public List<SafetyIncident> incidents() {
        return List.copyOf(incidents);
    }

    public long incidentCount(IncidentSeverity severity) {
        Objects.requireNonNull(severity, "severity");
        return incidents.stream().filter(i -> i.severity() == severity).count();
    }

    public int redFlagCount() {
        return redFlagCount;
    }

    public int personaOverrideCount() {
        return personaOverrideCount;
    }

    public DurationStatus durationStatus() {
        return durationPolicy.classify(elapsedSeconds);
    }

    public SafetySnapshot snapshot() {
        return new SafetySnapshot(
                new ArrayList<>(recent),
                baseline,
                totalSamples,
                elapsedSeconds,
                redFlagCount,
                personaOverrideCount,
                turnCount,
                durationStatus(),
                fatigueScore(),
                incidents
        );
    }
}
