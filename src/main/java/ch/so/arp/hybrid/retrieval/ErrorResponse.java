package ch.so.arp.hybrid.retrieval;

public record ErrorResponse(String code, String message) {
}
