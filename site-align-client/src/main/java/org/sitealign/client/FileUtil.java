package org.sitealign.client;

import java.io.BufferedInputStream;
import java.io.BufferedOutputStream;
import java.io.File;
import java.io.FileInputStream;
import java.io.FileOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.OutputStream;
import java.io.OutputStreamWriter;
import java.io.Reader;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.zip.GZIPInputStream;
import java.util.zip.GZIPOutputStream;

import org.sitealign.alignment.json.JsonUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Utility for reading alignment inputs and writing alignment results,
 * transparently (de)compressing files that end with .gz.
 */
public class FileUtil {

    public static Reader getExtensionBasedReader(final String fullPathName)
            throws IOException {

        final InputStream inputStream;
        if (fullPathName.endsWith(".gz")) {
            inputStream = new GZIPInputStream(new FileInputStream(fullPathName));
        } else {
            inputStream = new BufferedInputStream(new FileInputStream(fullPathName), BUFFER_SIZE);
        }

        return new InputStreamReader(inputStream, StandardCharsets.UTF_8);
    }

    public static Writer getExtensionBasedWriter(final String fullPathName)
            throws IOException {

        final OutputStream outputStream;
        if (fullPathName.endsWith(".gz")) {
            outputStream = new GZIPOutputStream(new FileOutputStream(fullPathName));
        } else {
            outputStream = new BufferedOutputStream(new FileOutputStream(fullPathName), BUFFER_SIZE);
        }

        return new OutputStreamWriter(outputStream, StandardCharsets.UTF_8);
    }

    public static void saveJsonFile(final String path,
                                    final Object data)
            throws IOException {

        final Path toPath = Paths.get(path).toAbsolutePath();

        LOG.info("saveJsonFile: entry");

        try (final Writer writer = getExtensionBasedWriter(toPath.toString())) {
            JsonUtils.MAPPER.writeValue(writer, data);
        } catch (final Throwable t) {
            throw new IOException("failed to write " + toPath, t);
        }

        LOG.info("saveJsonFile: exit, wrote data to {}", toPath);
    }

    /**
     * @throws IllegalArgumentException
     *   if the file cannot be read.
     */
    public static void validateReadableFile(final String path,
                                            final String context)
            throws IllegalArgumentException {
        final File file = new File(path).getAbsoluteFile();
        if (! file.isFile() || ! file.canRead()) {
            throw new IllegalArgumentException(context + " " + file.getAbsolutePath() + " must be a readable file");
        }
    }

    /**
     * @throws IllegalArgumentException
     *   if the file cannot be written.
     */
    public static void validateWritableFile(final String path,
                                            final String context)
            throws IllegalArgumentException {
        File file = new File(path).getAbsoluteFile();
        if (! file.exists()) {
            file = file.getParentFile();
        }
        if ((file == null) || ! file.canWrite()) {
            throw new IllegalArgumentException(context + " " + new File(path).getAbsolutePath() + " must be writeable");
        }
    }

    private static final Logger LOG = LoggerFactory.getLogger(FileUtil.class);

    private static final int BUFFER_SIZE = 65536;
}
