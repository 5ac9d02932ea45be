package com.contentforge.domain.content.model.valobj;

import com.contentforge.types.common.Constants;
import com.contentforge.types.enums.ArtifactKindEnum;

import java.util.ArrayList;
import java.util.List;

/**
 * Output of the voice-check step.
 */
public record VoiceCheckResult(boolean passed,
                               double score,
                               List<String> issues,
                               List<String> suggestions) implements Validatable {

    public VoiceCheckResult {
        issues = issues == null ? List.of() : List.copyOf(issues);
        suggestions = suggestions == null ? List.of() : List.copyOf(suggestions);
    }

    @Override
    public GateResult checkInvariants() {
        List<String> problems = new ArrayList<>();
        if (score < Constants.VOICE_SCORE_THRESHOLD) {
            problems.add("Brand voice score " + score + " below threshold " + Constants.VOICE_SCORE_THRESHOLD);
        }
        if (!passed) {
            problems.add("Brand voice validation failed");
        }
        return GateResult.of(problems);
    }

    @Override
    public ArtifactKindEnum artifactKind() {
        return ArtifactKindEnum.VOICE_CHECK_RESULT;
    }
}
