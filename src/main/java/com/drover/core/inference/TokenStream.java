package com.drover.core.inference;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Flux;

import java.io.Closeable;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.net.http.HttpTimeoutException;
import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Consumer;
import java.util.function.Function;
import java.util.stream.Stream;
import java.util.stream.StreamSupport;

/**
 * Lazy, finite, single-use sequence of generated text fragments.
 * <p>
 * Fragments are decoded from the backend's line-oriented stream, or taken from a reactive
 * {@link Flux}, only as the caller pulls them. A second call to {@link #iterator()} fails; the underlying connection is
 * closed once the stream ends, fails, or {@link #close()} is called.
 */
public final class TokenStream implements Iterable<String>, AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(TokenStream.class);

    /**
     * Decoded form of one raw line. {@code text} may be empty; {@code done} ends the stream.
     */
    public record Chunk(String text, boolean done) {
        public static final Chunk DONE = new Chunk("", true);

        public static Chunk of(String text) {
            return new Chunk(text == null ? "" : text, false);
        }
    }

    /**
     * Turns a raw line into a chunk, or {@code null} to skip the line.
     */
    @FunctionalInterface
    public interface ChunkDecoder {
        Chunk decode(String line);
    }

    private final String source;
    private final Iterator<String> lines;
    private final Closeable resource;
    private final ChunkDecoder decoder;
    private final AtomicBoolean consumed = new AtomicBoolean();
    private final AtomicBoolean closed = new AtomicBoolean();

    public TokenStream(String source, Iterator<String> lines, Closeable resource, ChunkDecoder decoder) {
        this.source = source;
        this.lines = lines;
        this.resource = resource;
        this.decoder = decoder;
    }

    /** A stream over already-known fragments. */
    public static TokenStream ofFragments(String source, List<String> fragments) {
        return new TokenStream(source, fragments.iterator(), () -> {}, Chunk::of);
    }

    /**
     * A stream over a reactive source. The subscription starts on the first pull and is cancelled
     * on {@link #close()}; failures of the source are mapped through {@code errors}.
     */
    public static TokenStream ofFlux(String source, Flux<String> fragments,
                                     Function<RuntimeException, InferenceException> errors) {
        var pull = new FluxPull(fragments, errors);
        return new TokenStream(source, pull, pull, Chunk::of);
    }

    @Override
    public Iterator<String> iterator() {
        if (!consumed.compareAndSet(false, true)) {
            throw new IllegalStateException("Token stream from " + source + " can only be consumed once");
        }
        return new FragmentIterator();
    }

    public Stream<String> stream() {
        return StreamSupport.stream(spliterator(), false).onClose(this::close);
    }

    /**
     * Drains the stream, handing each fragment to {@code onChunk} in generation order.
     *
     * @return the concatenation of all fragments
     */
    public String collect(Consumer<String> onChunk) {
        var full = new StringBuilder();
        try {
            for (String fragment : this) {
                full.append(fragment);
                if (onChunk != null) {
                    onChunk.accept(fragment);
                }
            }
        } finally {
            close();
        }
        return full.toString();
    }

    @Override
    public void close() {
        if (closed.compareAndSet(false, true)) {
            try {
                resource.close();
            } catch (IOException e) {
                log.debug("Failed to close token stream from {}: {}", source, e.getMessage());
            }
        }
    }

    private final class FragmentIterator implements Iterator<String> {

        private String next;
        private boolean finished;

        @Override
        public boolean hasNext() {
            if (next != null) return true;
            if (finished) return false;
            advance();
            return next != null;
        }

        @Override
        public String next() {
            if (!hasNext()) {
                throw new NoSuchElementException();
            }
            String fragment = next;
            next = null;
            return fragment;
        }

        private void advance() {
            try {
                while (!closed.get() && lines.hasNext()) {
                    Chunk chunk = decoder.decode(lines.next());
                    if (chunk == null) continue;
                    if (chunk.done()) {
                        finish();
                        if (!chunk.text().isEmpty()) next = chunk.text();
                        return;
                    }
                    if (!chunk.text().isEmpty()) {
                        next = chunk.text();
                        return;
                    }
                }
                finish();
            } catch (InferenceException e) {
                finish();
                throw e;
            } catch (UncheckedIOException e) {
                finish();
                if (e.getCause() instanceof HttpTimeoutException) {
                    throw new InferenceTimeoutException("Stream from " + source + " timed out", e.getCause());
                }
                throw new BackendUnavailableException(source, -1,
                        "Stream from " + source + " failed: " + e.getCause().getMessage(), e.getCause());
            }
        }

        private void finish() {
            finished = true;
            close();
        }
    }

    private static final class FluxPull implements Iterator<String>, Closeable {

        private final Flux<String> fragments;
        private final Function<RuntimeException, InferenceException> errors;
        private Stream<String> subscription;
        private Iterator<String> delegate;

        FluxPull(Flux<String> fragments, Function<RuntimeException, InferenceException> errors) {
            this.fragments = fragments;
            this.errors = errors;
        }

        @Override
        public boolean hasNext() {
            try {
                return subscribed().hasNext();
            } catch (InferenceException e) {
                throw e;
            } catch (RuntimeException e) {
                throw errors.apply(e);
            }
        }

        @Override
        public String next() {
            try {
                return subscribed().next();
            } catch (InferenceException | NoSuchElementException e) {
                throw e;
            } catch (RuntimeException e) {
                throw errors.apply(e);
            }
        }

        private Iterator<String> subscribed() {
            if (delegate == null) {
                subscription = fragments.toStream();
                delegate = subscription.iterator();
            }
            return delegate;
        }

        @Override
        public void close() {
            if (subscription != null) {
                subscription.close();
            }
        }
    }
}
