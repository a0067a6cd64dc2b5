package au.org.ala.renditions.store;

import com.google.common.io.ByteSink;
import com.google.common.io.ByteStreams;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.FilterOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;

/**
 * A {@link ByteSink} that writes to a temporary file next to the target and renames it into place when the
 * stream is closed, so readers never see a file that is still being written.
 * <p>
 * {@link #write(byte[])} and {@link #writeFrom(InputStream)} are all-or-nothing: if the write or the input fails,
 * the temporary file is removed and the target is untouched. A stream from {@link #openStream()} only knows about
 * failures of its own writes, so closing it after the caller gave up part way publishes whatever was written;
 * produce the bytes first and hand them to {@link #write(byte[])} instead.
 */
public class AtomicFileByteSink extends ByteSink {

    private static final Logger log = LoggerFactory.getLogger(AtomicFileByteSink.class);

    private final Path target;

    public AtomicFileByteSink(Path target) {
        this.target = target;
    }

    public Path getTarget() {
        return target;
    }

    @Override
    public OutputStream openStream() throws IOException {
        Path dir = target.getParent();
        createDirectories(dir);
        Path temp;
        try {
            temp = Files.createTempFile(dir, "." + target.getFileName().toString(), ".tmp");
        } catch (NoSuchFileException e) {
            // an empty directory can be swept by the cache janitor before the temp file lands in it
            log.debug("{} disappeared, creating it again", dir);
            createDirectories(dir);
            temp = Files.createTempFile(dir, "." + target.getFileName().toString(), ".tmp");
        }
        return new CommitOnCloseStream(Files.newOutputStream(temp), temp);
    }

    void createDirectories(Path dir) throws IOException {
        Files.createDirectories(dir);
    }

    @Override
    public void write(byte[] bytes) throws IOException {
        CommitOnCloseStream out = (CommitOnCloseStream) openStream();
        try {
            out.write(bytes);
        } catch (IOException | RuntimeException e) {
            out.abort();
            throw e;
        }
        out.close();
    }

    @Override
    public long writeFrom(InputStream input) throws IOException {
        CommitOnCloseStream out = (CommitOnCloseStream) openStream();
        long copied;
        try {
            copied = ByteStreams.copy(input, out);
        } catch (IOException | RuntimeException e) {
            out.abort();
            throw e;
        }
        out.close();
        return copied;
    }

    private void commit(Path temp) throws IOException {
        try {
            Files.move(temp, target, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
        } catch (AtomicMoveNotSupportedException e) {
            log.debug("Atomic move unsupported for {}, falling back to replace", target);
            Files.move(temp, target, StandardCopyOption.REPLACE_EXISTING);
        }
    }

    private final class CommitOnCloseStream extends FilterOutputStream {

        private final Path temp;
        private boolean failed;
        private boolean closed;

        CommitOnCloseStream(OutputStream out, Path temp) {
            super(out);
            this.temp = temp;
        }

        @Override
        public void write(int b) throws IOException {
            try {
                out.write(b);
            } catch (IOException | RuntimeException e) {
                failed = true;
                throw e;
            }
        }

        @Override
        public void write(byte[] b, int off, int len) throws IOException {
            try {
                out.write(b, off, len);
            } catch (IOException | RuntimeException e) {
                failed = true;
                throw e;
            }
        }

        void abort() {
            failed = true;
            try {
                close();
            } catch (IOException e) {
                log.warn("Could not discard {}", temp, e);
            }
        }

        @Override
        public void close() throws IOException {
            if (closed) {
                return;
            }
            closed = true;
            try {
                super.close();
            } catch (IOException e) {
                failed = true;
                Files.deleteIfExists(temp);
                throw e;
            }
            if (failed) {
                Files.deleteIfExists(temp);
                return;
            }
            try {
                commit(temp);
            } catch (IOException e) {
                Files.deleteIfExists(temp);
                throw e;
            }
        }
    }
}
