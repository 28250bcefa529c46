package com.artifactduo.server.service.transfer;

import com.artifactduo.server.model.internal.PipelineContext;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;

/**
 * Stream copy in fixed size chunks with a cooperative checkpoint before every chunk.
 */
public class ChunkedCopier {

    public static final int CHUNK_SIZE = 64 * 1024;

    private ChunkedCopier() {}

    /**
     * Copies {@code in} to {@code out}.
     * <p>
     * Before writing a chunk the copier waits while the run is paused. With {@code cancellable}
     * it also stops as soon as the run is cancelled; otherwise cancellation only ends the pause
     * and the copy runs to the end.
     *
     * @return {@code false} if the copy stopped early because of cancellation
     */
    public static boolean copy(
            InputStream in,
            OutputStream out,
            PipelineContext context,
            ProgressTracker progressTracker,
            boolean cancellable) throws IOException {
        byte[] buffer = new byte[CHUNK_SIZE];
        int read = in.readNBytes(buffer, 0, CHUNK_SIZE);
        while (read > 0) {
            if (cancellable && context.isCancelled()) {
                return false;
            }
            if (!context.awaitIfPaused() && cancellable) {
                return false;
            }
            out.write(buffer, 0, read);
            progressTracker.advance(read);
            read = in.readNBytes(buffer, 0, CHUNK_SIZE);
        }
        return true;
    }
}
