package com.netcourier.docqa.service.generation;

/**
 * Items of {@link FallbackGenerationChain#stream}: answer fragments, backend hops, and a final
 * marker naming the backend that finished the answer.
 */
public record GenerationSignal(Type type, String backend, String content, String fallbackTo) {

    public enum Type {
        FRAGMENT,
        FALLBACK,
        COMPLETED
    }

    public static GenerationSignal fragment(String backend, String content) {
        return new GenerationSignal(Type.FRAGMENT, backend, content, null);
    }

    public static GenerationSignal fallback(String from, String to) {
        return new GenerationSignal(Type.FALLBACK, from, null, to);
    }

    public static GenerationSignal completed(String backend) {
        return new GenerationSignal(Type.COMPLETED, backend, null, null);
    }

    /**
     * {@code "from -> to"} for fallback signals.
     */
    public String hop() {
        return backend + " -> " + fallbackTo;
    }
}
