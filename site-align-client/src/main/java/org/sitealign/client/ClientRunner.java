package org.sitealign.client;

import java.util.Arrays;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Runs one alignment tool (site or legacy building) as a process.
 *
 * <p>A successful run logs {@code run: exit, processing completed} and exits with status 0.
 * Any failure (unreadable input, malformed site or building data, a drawing with an invalid pose,
 * an unwritable output file) is logged with its stack trace together with the tool's arguments,
 * followed by {@code run: exit, processing failed}, and the process exits with status 1.
 * A missing exit message means the process was killed.</p>
 */
public abstract class ClientRunner {

    private final String[] args;

    /**
     * @param  args  command line arguments for the tool.
     */
    public ClientRunner(final String[] args) {
        this.args = args;
    }

    public void run() {

        LOG.info("run: entry");

        final long startTime = System.currentTimeMillis();

        try {
            runClient(args);
            LOG.info("run: exit, processing completed in {} ms", System.currentTimeMillis() - startTime);
            System.exit(0);
        } catch (final Throwable t) {
            LOG.error("run: alignment failed for arguments {}", Arrays.toString(args), t);
            LOG.info("run: exit, processing failed after {} ms", System.currentTimeMillis() - startTime);
            System.exit(1);
        }

    }

    /**
     * @param  args  command line arguments for the tool.
     *
     * @throws Exception
     *   if the tool fails for any reason.
     */
    public abstract void runClient(final String[] args) throws Exception;

    private static final Logger LOG = LoggerFactory.getLogger(ClientRunner.class);
}
