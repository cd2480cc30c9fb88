package com.questrail.refraction.api;

import java.util.EnumMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * ClassifiedResponse
 * -----------------------------------------------------------------------------
 * Output of the upstream language-understanding collaborator for a single
 * patient utterance.
 *
 * <p>The engine never inspects utterance text. Everything it knows about what
 * the patient said arrives here, already classified.</p>
 *
 * @param intent          classified intent
 * @param confidence      classifier confidence in [0.0, 1.0]
 * @param slots           filled slots (immutable copy)
 * @param sentiment       classified sentiment
 * @param redFlag         an emergency symptom keyword was detected
 * @param personaOverride the patient attempted to redirect the system's role
 */
public record ClassifiedResponse(
        Intent intent,
        double confidence,
        Map<SlotKey, String> slots,
        Sentiment sentiment,
        boolean redFlag,
        boolean personaOverride
) {
    public ClassifiedResponse {
        Objects.requireNonNull(intent, "intent");
        Objects.requireNonNull(slots, "slots");
        Objects.requireNonNull(sentiment, "sentiment");
        if (Double.isNaN(confidence) || confidence < 0.0 || confidence > 1.0) {
            throw new IllegalArgumentException("confidence must be within [0.0, 1.0]: " + confidence);
        }
        slots = Map.copyOf(slots);
    }

    public Optional<String> slot(SlotKey key) {
        return Optional.ofNullable(slots.get(key));
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private Intent intent = Intent.UNKNOWN;
        private double confidence;
        private final Map<SlotKey, String> slots = new EnumMap<>(SlotKey.class);
        private Sentiment sentiment = Sentiment.CONFIDENT;
        private boolean redFlag;
        private boolean personaOverride;

        private Builder() {}

        public Builder intent(Intent intent) {
            this.intent = intent;
            return this;
        }

        public Builder confidence(double confidence) {
            this.confidence = confidence;
            return this;
        }

        public Builder slot(SlotKey key, String value) {
            slots.put(Objects.requireNonNull(key, "key"), Objects.requireNonNull(value, "value"));
            return this;
        }

        public Builder sentiment(Sentiment sentiment) {
            this.sentiment = sentiment;
            return this;
        }

        public Builder redFlag(boolean redFlag) {
            this.redFlag = redFlag;
            return this;
        }

        public Builder personaOverride(boolean personaOverride) {
            this.personaOverride = personaOverride;
            return this;
        }

        public ClassifiedResponse build() {
            return new ClassifiedResponse(intent, confidence, slots, sentiment, redFlag, personaOverride);
        }
    }
}
