package com.lexiqa.qaengine.infra.persistence;

import com.lexiqa.qaengine.api.exceptions.DocumentParseException;
import com.lexiqa.qaengine.api.model.Profile;
import com.lexiqa.qaengine.api.model.ProfileInfo;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.logging.Level;
import java.util.logging.Logger;
import java.util.stream.Stream;

/**
 * Lists the profile documents of a directory.
 *
 * <p>Documents that parse are described from their content. Documents that do not
 * are still listed: name, description and language are recovered by a plain text
 * scan, the name falling back to the file name, and the rule count is reported as -1.
 */
public class ProfileDiscovery {

    private static final Logger logger = Logger.getLogger(ProfileDiscovery.class.getName());

    private final ProfileDocumentReader reader = new ProfileDocumentReader();
    private final Path directory;
    private final String suffix;

    public ProfileDiscovery(Path directory, String suffix) {
        this.directory = directory;
        this.suffix = suffix;
    }

    /**
     * @return profiles sorted by file name; empty when the directory does not exist
     */
    public List<ProfileInfo> discover() throws IOException {
        if (!Files.isDirectory(directory)) {
            return List.of();
        }
        List<Path> files;
        try (Stream<Path> stream = Files.list(directory)) {
            files = stream
                    .filter(Files::isRegularFile)
                    .filter(p -> p.getFileName().toString().endsWith(suffix))
                    .sorted()
                    .toList();
        }
        List<ProfileInfo> profiles = new ArrayList<>(files.size());
        for (Path file : files) {
            try {
                profiles.add(describe(file));
            } catch (IOException e) {
                logger.log(Level.WARNING, "Skipping unreadable profile " + file, e);
            }
        }
        return profiles;
    }

    ProfileInfo describe(Path file) throws IOException {
        try (InputStream in = Files.newInputStream(file)) {
            Profile profile = reader.read(in, file.getFileName().toString());
            return new ProfileInfo(file.toAbsolutePath().toString(), profile.name(),
                    profile.description(), profile.language(), profile.rules().size());
        } catch (DocumentParseException e) {
            logger.warning(() -> "Profile " + file + " does not parse (" + e.getMessage()
                    + "), using best-effort metadata");
            String content = Files.readString(file, StandardCharsets.UTF_8);
            String name = extract(content, "name");
            return new ProfileInfo(file.toAbsolutePath().toString(),
                    name.isEmpty() ? file.getFileName().toString() : name,
                    extract(content, "description"),
                    extract(content, "language"),
                    -1);
        }
    }

    /**
     * Text of the first {@code <tag>...</tag>} pair, trimmed and unescaped, or empty.
     */
    static String extract(String content, String tag) {
        String open = "<" + tag + ">";
        int start = content.indexOf(open);
        if (start < 0) {
            return "";
        }
        start += open.length();
        int end = content.indexOf("</" + tag + ">", start);
        if (end < 0) {
            return "";
        }
        return XmlText.unescape(content.substring(start, end).trim());
    }

    public Path getDirectory() {
        return directory;
    }
}
