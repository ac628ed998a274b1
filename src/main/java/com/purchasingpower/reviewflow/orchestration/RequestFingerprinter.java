package com.purchasingpower.reviewflow.orchestration;

import com.google.common.hash.Hasher;
import com.google.common.hash.Hashing;
import com.purchasingpower.reviewflow.model.llm.ModelTier;
import com.purchasingpower.reviewflow.model.retrieval.ContextChunk;
import com.purchasingpower.reviewflow.parser.UnifiedDiffParser;
import org.springframework.stereotype.Component;

import java.nio.charset.StandardCharsets;
import java.util.List;

/**
 * Deterministic cache keys for model requests.
 *
 * fingerprint = sha256(tier, template version, normalized diff, context hash, extra)
 */
@Component
public class RequestFingerprinter {

    public String fingerprint(ModelTier tier, String templateVersion, String diff, List<ContextChunk> context, String extra) {
        return Hashing.sha256().newHasher()
                .putString(tier.name(), StandardCharsets.UTF_8)
                .putChar('\u0000')
                .putString(templateVersion == null ? "" : templateVersion, StandardCharsets.UTF_8)
                .putChar('\u0000')
                .putString(UnifiedDiffParser.normalize(diff), StandardCharsets.UTF_8)
                .putChar('\u0000')
                .putString(contextHash(context), StandardCharsets.UTF_8)
                .putChar('\u0000')
                .putString(extra == null ? "" : extra, StandardCharsets.UTF_8)
                .hash()
                .toString();
    }

    public String contextHash(List<ContextChunk> context) {
        Hasher hasher = Hashing.sha256().newHasher();
        if (context != null) {
            for (ContextChunk chunk : context) {
                hasher.putString(chunk.getLocation(), StandardCharsets.UTF_8)
                        .putChar('\u0000')
                        .putString(chunk.getText() == null ? "" : chunk.getText(), StandardCharsets.UTF_8)
                        .putChar('\u0001');
            }
        }
        return hasher.hash().toString();
    }
}
