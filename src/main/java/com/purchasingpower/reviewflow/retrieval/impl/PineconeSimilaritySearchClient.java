package com.purchasingpower.reviewflow.retrieval.impl;

import com.google.protobuf.Struct;
import com.google.protobuf.Value;
import com.purchasingpower.reviewflow.configuration.AppProperties;
import com.purchasingpower.reviewflow.model.CallContext;
import com.purchasingpower.reviewflow.model.ServiceType;
import com.purchasingpower.reviewflow.model.retrieval.ChunkOrigin;
import com.purchasingpower.reviewflow.model.retrieval.CodeBlock;
import com.purchasingpower.reviewflow.model.retrieval.ContextChunk;
import com.purchasingpower.reviewflow.retrieval.SearchOutcome;
import com.purchasingpower.reviewflow.retrieval.SimilaritySearchClient;
import com.purchasingpower.reviewflow.util.ExternalCallLogger;
import dev.langchain4j.data.embedding.Embedding;
import dev.langchain4j.model.embedding.EmbeddingModel;
import io.pinecone.clients.Index;
import io.pinecone.clients.Pinecone;
import io.pinecone.unsigned_indices_model.QueryResponseWithUnsignedIndices;
import io.pinecone.unsigned_indices_model.ScoredVectorWithUnsignedIndices;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Similarity search against a Pinecone index.
 *
 * <p>Each query block is embedded with the local embedding model and queried separately;
 * results are filtered to the review's repository through the {@code repo_name} metadata field.
 * Expected metadata per vector: {@code file_path}, {@code start_line}, {@code content},
 * and optionally {@code chunk_type} (code, doc, history).
 */
@Slf4j
@Component
@ConditionalOnProperty(prefix = "app.review.retrieval", name = "provider", havingValue = "pinecone")
public class PineconeSimilaritySearchClient implements SimilaritySearchClient {

    private final Pinecone client;
    private final EmbeddingModel embeddingModel;
    private final String indexName;
    private final String namespace;

    public PineconeSimilaritySearchClient(AppProperties props, EmbeddingModel embeddingModel) {
        this.client = new Pinecone.Builder(props.getPinecone().getApiKey()).build();
        this.embeddingModel = embeddingModel;
        this.indexName = props.getPinecone().getIndexName();
        this.namespace = props.getPinecone().getNamespace();
    }

    @Override
    public SearchOutcome search(List<CodeBlock> queryChunks, String repositoryRef, int k) {
        CallContext call = ExternalCallLogger.startCall(ServiceType.PINECONE, "query", log);
        call.logRequest("Similarity query",
                "Index", indexName,
                "Repository", repositoryRef,
                "Blocks", queryChunks.size(),
                "TopK", k);
        try {
            Index index = client.getIndexConnection(indexName);
            Struct filter = buildRepoFilter(repositoryRef);
            List<ContextChunk> chunks = new ArrayList<>();

            for (CodeBlock block : queryChunks) {
                Embedding embedding = embeddingModel.embed(block.getText()).content();
                QueryResponseWithUnsignedIndices response = index.query(
                        k, embedding.vectorAsList(), null, null, null, namespace, filter, false, true);
                if (response.getMatchesList() == null) {
                    continue;
                }
                for (ScoredVectorWithUnsignedIndices match : response.getMatchesList()) {
                    chunks.add(toChunk(match));
                }
            }

            call.logResponse("Similarity query answered", "Matches", chunks.size());
            return SearchOutcome.available(chunks);
        } catch (Exception e) {
            call.logError(e.getMessage(), e);
            return SearchOutcome.unavailable(e.getClass().getSimpleName() + ": " + e.getMessage());
        }
    }

    @Override
    public String getName() {
        return "pinecone:" + indexName;
    }

    /**
     * {@code { "repo_name": { "$eq": repositoryRef } }}, or no filter when the repository is unknown.
     */
    private Struct buildRepoFilter(String repositoryRef) {
        if (repositoryRef == null || repositoryRef.isBlank()) {
            return null;
        }
        return Struct.newBuilder()
                .putFields("repo_name", Value.newBuilder()
                        .setStructValue(Struct.newBuilder()
                                .putFields("$eq", Value.newBuilder().setStringValue(repositoryRef).build())
                                .build())
                        .build())
                .build();
    }

    private ContextChunk toChunk(ScoredVectorWithUnsignedIndices match) {
        Map<String, Value> fields = match.getMetadata() != null ? match.getMetadata().getFieldsMap() : Map.of();
        String filePath = stringField(fields, "file_path", match.getId());
        String startLine = fields.containsKey("start_line")
                ? String.valueOf((long) fields.get("start_line").getNumberValue())
                : null;

        return ContextChunk.builder()
                .location(startLine != null ? filePath + ":" + startLine : filePath)
                .text(stringField(fields, "content", ""))
                .relevance(match.getScore())
                .origin(ChunkOrigin.fromMetadata(stringField(fields, "chunk_type", null)))
                .build();
    }

    private String stringField(Map<String, Value> fields, String name, String fallback) {
        Value value = fields.get(name);
        return value != null && value.getKindCase() == Value.KindCase.STRING_VALUE ? value.getStringValue() : fallback;
    }
}
