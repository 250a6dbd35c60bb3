package ph.extremelogic.common.tracer.handler;

import ph.extremelogic.common.tracer.ConfigurationException;
import ph.extremelogic.common.tracer.LogEvent;
import ph.extremelogic.common.tracer.ResourceException;
import ph.extremelogic.common.tracer.layout.Layout;
import ph.extremelogic.common.tracer.layout.TracerLayout;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.time.format.DateTimeFormatter;

/**
 * Writes plain event messages into a log directory.
 *
 * <p>The file is {@code yyyy-MM-dd.log} for the event's date, or {@code latest.log} when dates are
 * off. Unless the file is shared, the section name is prepended ({@code billing.latest.log}). A custom
 * name replaces all of this.</p>
 *
 * <p>With {@code append} disabled an existing file is emptied right before the first write of this
 * handler, later events are appended.</p>
 */
public final class FileHandler implements Handler {
    private static final DateTimeFormatter DATE_FORMATTER = DateTimeFormatter.ofPattern("yyyy-MM-dd");
    private static final String LATEST_NAME = "latest.log";

    private final Path directory;
    private final boolean append;
    private final boolean shareFile;
    private final boolean useDate;
    private final String customName;
    private final Layout<String> layout = new TracerLayout(false);

    private boolean handledOverwrite = false;

    public FileHandler(Path directory) {
        this(new Builder(directory));
    }

    private FileHandler(Builder builder) {
        if (builder.shareFile && !builder.append) {
            throw new ConfigurationException("A shared log file must be opened in append mode");
        }
        this.directory = builder.directory;
        this.append = builder.append;
        this.shareFile = builder.shareFile;
        this.useDate = builder.useDate;
        this.customName = builder.customName;

        try {
            Files.createDirectories(directory);
        } catch (IOException e) {
            throw new ResourceException("Failed to create log directory " + directory, e);
        }
    }

    String getFileName(LogEvent event) {
        if (customName != null) {
            return customName;
        }
        String name = useDate ? event.getTimestamp().format(DATE_FORMATTER) + ".log" : LATEST_NAME;
        if (!shareFile) {
            name = event.getSection() + "." + name;
        }
        return name;
    }

    @Override
    public synchronized void handle(LogEvent event) {
        Path file = directory.resolve(getFileName(event));
        try {
            if (!handledOverwrite && !append && Files.exists(file)) {
                Files.write(file, new byte[0], StandardOpenOption.TRUNCATE_EXISTING);
            }
            handledOverwrite = true;

            Files.writeString(file, layout.toSerializable(event) + "\n", StandardCharsets.UTF_8,
                    StandardOpenOption.CREATE, StandardOpenOption.APPEND);
        } catch (IOException e) {
            throw new ResourceException("Failed to write log file " + file, e);
        }
    }

    public Path getDirectory() {
        return directory;
    }

    @Override
    public String getName() {
        return "FileHandler:" + directory;
    }

    public static class Builder {
        private final Path directory;
        private boolean append = true;
        private boolean shareFile = true;
        private boolean useDate = true;
        private String customName;

        public Builder(Path directory) {
            this.directory = directory;
        }

        public Builder append(boolean append) {
            this.append = append;
            return this;
        }

        /**
         * Whether all sections logging into the directory write the same file.
         */
        public Builder shareFile(boolean shareFile) {
            this.shareFile = shareFile;
            return this;
        }

        public Builder useDate(boolean useDate) {
            this.useDate = useDate;
            return this;
        }

        public Builder customName(String customName) {
            this.customName = customName;
            return this;
        }

        public FileHandler build() {
            return new FileHandler(this);
        }
    }
}
