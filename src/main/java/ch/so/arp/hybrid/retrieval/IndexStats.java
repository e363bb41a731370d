package ch.so.arp.hybrid.retrieval;

import com.fasterxml.jackson.annotation.JsonProperty;

public record IndexStats(
        @JsonProperty("documents") int documents,
        @JsonProperty("vocabulary_size") int vocabularySize,
        @JsonProperty("average_document_length") double averageDocumentLength) {

    static IndexStats of(CorpusIndex index) {
        SparseIndex sparseIndex = index.sparseIndex();
        return new IndexStats(index.size(), sparseIndex.vocabularySize(), sparseIndex.averageDocumentLength());
    }
}
