package com.localization.generator.codegen.discovery;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Collectors;
import java.util.stream.Stream;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.localization.generator.codegen.model.input.TableFormat;

/**
 * Expands input files and directories into the list of tables to load.
 *
 * Files are taken as given. Directories are walked recursively:
 * - {@code .strings} files are selected when the directory itself, or a directory below it,
 *   is named {@code <locale>.lproj};
 * - {@code .properties} bundles contribute their {@code _<locale>} variant when present,
 *   otherwise their default (unsuffixed) file.
 * The result is sorted and free of duplicates.
 */
public class ResourceDiscoveryService {
    private static final Logger log = LoggerFactory.getLogger(ResourceDiscoveryService.class);

    private static final String LPROJ_SUFFIX = ".lproj";

    // Messages_en.properties, Messages_pt_BR.properties
    private static final Pattern LOCALIZED_PROPERTIES = Pattern.compile(
            "^(.+?)_([a-z]{2,3}(?:_[A-Z]{2})?)\\.properties$");

    public List<Path> discoverTableFiles(List<Path> inputs, String locale) throws IOException {
        Set<Path> found = new TreeSet<>();
        for (Path input : inputs) {
            Path normalized = input.toAbsolutePath().normalize();
            if (Files.isDirectory(normalized)) {
                found.addAll(scanDirectory(normalized, locale));
            } else {
                found.add(normalized);
            }
        }
        log.debug("Discovered {} table files", found.size());
        return new ArrayList<>(found);
    }

    private List<Path> scanDirectory(Path dir, String locale) throws IOException {
        List<Path> files;
        try (Stream<Path> stream = Files.walk(dir)) {
            files = stream.filter(Files::isRegularFile).sorted().collect(Collectors.toList());
        }

        List<Path> selected = new ArrayList<>();
        String lproj = locale + LPROJ_SUFFIX;
        for (Path file : files) {
            if (TableFormat.forPath(file).orElse(null) == TableFormat.STRINGS && isInDirectory(file, dir, lproj)) {
                selected.add(file);
            }
        }
        selected.addAll(selectPropertiesBundles(files, locale));
        return selected;
    }

    private boolean isInDirectory(Path file, Path root, String directoryName) {
        Path rootName = root.getFileName();
        if (rootName != null && rootName.toString().equals(directoryName)) {
            return true;
        }
        for (Path component : root.relativize(file)) {
            if (component.toString().equals(directoryName)) {
                return true;
            }
        }
        return false;
    }

    /**
     * Picks one file per properties bundle (directory + base name).
     */
    private List<Path> selectPropertiesBundles(List<Path> files, String locale) {
        String wantedSuffix = locale.replace('-', '_');
        Map<Path, Path> defaults = new TreeMap<>();
        Map<Path, Path> localized = new TreeMap<>();

        for (Path file : files) {
            if (TableFormat.forPath(file).orElse(null) != TableFormat.PROPERTIES) {
                continue;
            }
            String fileName = file.getFileName().toString();
            Matcher matcher = LOCALIZED_PROPERTIES.matcher(fileName);
            if (matcher.matches()) {
                if (matcher.group(2).equals(wantedSuffix)) {
                    localized.put(file.resolveSibling(matcher.group(1)), file);
                }
            } else {
                String baseName = fileName.substring(0, fileName.length() - TableFormat.PROPERTIES.getExtension().length());
                defaults.put(file.resolveSibling(baseName), file);
            }
        }

        Map<Path, Path> chosen = new TreeMap<>(defaults);
        chosen.putAll(localized);
        return new ArrayList<>(chosen.values());
    }
}
