package org.iceforge.quarry.dataset;

import org.iceforge.quarry.QuarryException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.io.buffer.DataBuffer;
import org.springframework.core.io.buffer.DataBufferUtils;
import org.springframework.http.HttpHeaders;
import org.springframework.http.client.reactive.ReactorClientHttpConnector;
import org.springframework.web.reactive.function.client.ClientResponse;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientRequestException;
import org.springframework.web.reactive.function.client.WebClientResponseException;
import reactor.core.Exceptions;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.netty.http.client.HttpClient;

import java.net.URI;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Optional;
import java.util.OptionalLong;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicLong;

/**
 * HTTP access to remote datasets: size probe, ranged reads of the head and tail, and streaming
 * download into a file. Every failure surfaces as {@link NetworkException}.
 */
public class DatasetFetcher {
    private static final Logger logger = LoggerFactory.getLogger(DatasetFetcher.class);

    private final WebClient webClient;
    private final Duration headTimeout;
    private final Duration downloadTimeout;

    public DatasetFetcher(WebClient.Builder builder, Duration headTimeout, Duration downloadTimeout) {
        HttpClient httpClient = HttpClient.create().followRedirect(true);
        this.webClient = builder.clientConnector(new ReactorClientHttpConnector(httpClient)).build();
        this.headTimeout = headTimeout;
        this.downloadTimeout = downloadTimeout;
    }

    /**
     * HEAD request. Any non-2xx status is a failure.
     *
     * @return the advertised Content-Length, if the server sent one
     */
    public OptionalLong probe(String url) {
        try {
            long length = webClient.head()
                    .uri(toUri(url))
                    .retrieve()
                    .onStatus(status -> !status.is2xxSuccessful(), ClientResponse::createException)
                    .toBodilessEntity()
                    .timeout(headTimeout)
                    .map(resp -> resp.getHeaders().getContentLength())
                    .blockOptional()
                    .orElse(-1L);
            return length >= 0 ? OptionalLong.of(length) : OptionalLong.empty();
        } catch (RuntimeException e) {
            throw classify(url, e);
        }
    }

    /** First {@code n} bytes of the resource, or fewer if it is shorter. */
    public byte[] readHead(String url, int n) {
        try {
            Flux<DataBuffer> body = webClient.get()
                    .uri(toUri(url))
                    .header(HttpHeaders.RANGE, "bytes=0-" + (n - 1))
                    .retrieve()
                    .onStatus(status -> !status.is2xxSuccessful(), ClientResponse::createException)
                    .bodyToFlux(DataBuffer.class);
            return DataBufferUtils.join(DataBufferUtils.takeUntilByteCount(body, n))
                    .map(buf -> toBytes(buf, n))
                    .timeout(headTimeout)
                    .blockOptional()
                    .orElse(new byte[0]);
        } catch (RuntimeException e) {
            throw classify(url, e);
        }
    }

    /**
     * Last {@code n} bytes via a suffix range. Empty when the server ignores ranges, since reading
     * the whole body just for the footer is what the download does anyway.
     */
    public Optional<byte[]> readTail(String url, int n) {
        try {
            return webClient.get()
                    .uri(toUri(url))
                    .header(HttpHeaders.RANGE, "bytes=-" + n)
                    .exchangeToMono(resp -> {
                        if (resp.statusCode().value() != 206) {
                            return resp.releaseBody().then(Mono.<byte[]>empty());
                        }
                        return DataBufferUtils.join(resp.bodyToFlux(DataBuffer.class))
                                .map(buf -> toBytes(buf, Integer.MAX_VALUE));
                    })
                    .timeout(headTimeout)
                    .blockOptional();
        } catch (RuntimeException e) {
            throw classify(url, e);
        }
    }

    /**
     * Streams the body into {@code target}, aborting once more than {@code maxBytes} arrive.
     *
     * @return bytes written
     */
    public long download(String url, Path target, long maxBytes) {
        AtomicLong written = new AtomicLong();
        try {
            Flux<DataBuffer> body = webClient.get()
                    .uri(toUri(url))
                    .retrieve()
                    .onStatus(status -> !status.is2xxSuccessful(), ClientResponse::createException)
                    .bodyToFlux(DataBuffer.class)
                    .map(buf -> {
                        if (written.addAndGet(buf.readableByteCount()) > maxBytes) {
                            DataBufferUtils.release(buf);
                            throw new DatasetFormatException("File exceeds maximum size of " + maxBytes + " bytes: " + url);
                        }
                        return buf;
                    });
            DataBufferUtils.write(body, target).timeout(downloadTimeout).block();
            logger.debug("Downloaded {} bytes from {}", written.get(), url);
            return written.get();
        } catch (RuntimeException e) {
            throw classify(url, e);
        }
    }

    private static URI toUri(String url) {
        try {
            return URI.create(url);
        } catch (IllegalArgumentException e) {
            throw new NetworkException("Invalid URL: " + url, null, e);
        }
    }

    private static byte[] toBytes(DataBuffer buf, int max) {
        try {
            byte[] bytes = new byte[Math.min(buf.readableByteCount(), max)];
            buf.read(bytes);
            return bytes;
        } finally {
            DataBufferUtils.release(buf);
        }
    }

    private static QuarryException classify(String url, RuntimeException e) {
        if (e instanceof QuarryException q) {
            return q;
        }
        Throwable t = Exceptions.unwrap(e);
        if (t instanceof QuarryException q) {
            return q;
        }
        if (t instanceof WebClientResponseException w) {
            int status = w.getStatusCode().value();
            return new NetworkException("Could not access URL (HTTP " + status + "): " + url, status, w);
        }
        if (t instanceof TimeoutException) {
            return new NetworkException("Timed out accessing URL: " + url, null, t);
        }
        if (t instanceof WebClientRequestException w) {
            Throwable root = w.getMostSpecificCause();
            return new NetworkException("Could not access URL: " + url + " (" + root.getMessage() + ")", null, w);
        }
        return new NetworkException("Could not access URL: " + url + " (" + t.getMessage() + ")", null, t);
    }
}
