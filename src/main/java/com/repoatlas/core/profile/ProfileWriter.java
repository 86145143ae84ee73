package com.repoatlas.core.profile;

import com.repoatlas.core.config.AtlasProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.HashSet;
import java.util.Set;

/**
 * Persists the profile under the root's context directory. An existing profile newer
 * than every scanned file is left alone unless regeneration is forced.
 */
@Component
public class ProfileWriter {

    private static final Logger log = LoggerFactory.getLogger(ProfileWriter.class);

    static final String PROFILE_FILE = "profile.md";
    static final String MODULES_DIR = "modules";

    public enum Outcome { WRITTEN, SKIPPED_FRESH }

    private final String outputDir;

    public ProfileWriter(AtlasProperties properties) {
        this.outputDir = properties.getProfile().getOutputDir();
    }

    public Path profilePath(Path root) {
        return root.resolve(outputDir).resolve(PROFILE_FILE);
    }

    /** True when a profile exists and was written after the newest source change. */
    public boolean isFresh(Path root, Instant newestChange) {
        Path profile = profilePath(root);
        if (!Files.isRegularFile(profile)) {
            return false;
        }
        try {
            return Files.getLastModifiedTime(profile).toInstant().isAfter(newestChange);
        } catch (IOException e) {
            log.debug("Cannot stat {}: {}", profile, e.getMessage());
            return false;
        }
    }

    public Outcome write(Path root, ProfileResult result, Instant newestChange, boolean force) {
        if (!force && isFresh(root, newestChange)) {
            log.info("Profile {} is newer than all sources; skipping (use --force to regenerate)", profilePath(root));
            return Outcome.SKIPPED_FRESH;
        }
        try {
            Path profile = profilePath(root);
            Files.createDirectories(profile.getParent());
            Files.writeString(profile, result.main().render(), StandardCharsets.UTF_8);

            Path modulesDir = profile.getParent().resolve(MODULES_DIR);
            Files.createDirectories(modulesDir);
            Set<String> written = new HashSet<>();
            for (Profile map : result.moduleMaps()) {
                String fileName = fileNameFor(map.name());
                Files.writeString(modulesDir.resolve(fileName), map.render(), StandardCharsets.UTF_8);
                written.add(fileName);
            }
            deleteStaleMaps(modulesDir, written);
            log.info("Wrote profile {} and {} module map(s)", profile, written.size());
            return Outcome.WRITTEN;
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to write profile under " + root.resolve(outputDir), e);
        }
    }

    static String fileNameFor(String moduleName) {
        return moduleName.replaceAll("[^A-Za-z0-9._-]", "_") + ".md";
    }

    private static void deleteStaleMaps(Path modulesDir, Set<String> keep) throws IOException {
        try (DirectoryStream<Path> entries = Files.newDirectoryStream(modulesDir, "*.md")) {
            for (Path entry : entries) {
                if (!keep.contains(entry.getFileName().toString())) {
                    Files.delete(entry);
                    log.debug("Removed stale module map {}", entry);
                }
            }
        }
    }
}
