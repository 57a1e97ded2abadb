package com.dbtide.backend.service;

import com.dbtide.backend.config.DbtIdeProperties;
import com.dbtide.backend.dto.DbtProjectSpec;
import com.dbtide.backend.exception.InvalidDocumentEncodingException;
import com.dbtide.backend.exception.ProjectLoadException;
import com.dbtide.backend.outline.MacroDefinition;
import com.dbtide.backend.outline.TemplateOutline;
import com.dbtide.backend.syntax.Parser;
import com.dbtide.backend.text.DocumentDecoder;
import com.dbtide.backend.text.PositionFinder;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import jakarta.annotation.PostConstruct;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.stream.Stream;

/**
 * Discovers the dbt project under the configured root: its {@code dbt_project.yml}, the models below its
 * model paths, the macros below its macro paths and the packages installed into it.
 */
@Service
public class ProjectService {

    private static final Logger logger = LoggerFactory.getLogger(ProjectService.class);

    static final String PROJECT_FILE = "dbt_project.yml";

    private final DbtIdeProperties properties;
    private final ObjectMapper yamlMapper = new ObjectMapper(new YAMLFactory());
    private volatile ProjectIndex index;

    public ProjectService(DbtIdeProperties properties) {
        this.properties = properties;
        this.index = ProjectIndex.empty(root());
    }

    @PostConstruct
    public void init() {
        try {
            reload();
        } catch (ProjectLoadException e) {
            logger.warn("No dbt project loaded from {}: {}", root(), e.getMessage());
        }
    }

    public ProjectIndex index() {
        return index;
    }

    public ProjectIndex reload() throws ProjectLoadException {
        long startTime = System.currentTimeMillis();
        ProjectIndex loaded = load(root(), null);
        index = loaded;
        logger.info("Loaded dbt project '{}' from {} in {}ms: {} models, {} macros, {} packages",
                loaded.spec().name(),
                loaded.root(),
                System.currentTimeMillis() - startTime,
                loaded.models().size(),
                loaded.allMacros().size(),
                loaded.packages().size());
        return loaded;
    }

    private Path root() {
        return Path.of(properties.projectRoot()).toAbsolutePath().normalize();
    }

    private ProjectIndex load(Path root, String packageName) throws ProjectLoadException {
        DbtProjectSpec spec = readSpec(root.resolve(PROJECT_FILE));
        String macroOwner = packageName == null ? null : (spec.name().isEmpty() ? packageName : spec.name());

        Map<String, Path> models = new TreeMap<>();
        for (Path file : sqlFiles(root, spec.modelPaths())) {
            String fileName = file.getFileName().toString();
            Path previous = models.putIfAbsent(fileName.substring(0, fileName.length() - ".sql".length()), file);
            if (previous != null) {
                logger.warn("Model {} is defined twice: {} and {}", fileName, previous, file);
            }
        }

        List<ProjectMacro> macros = new ArrayList<>();
        for (Path file : sqlFiles(root, spec.macroPaths())) {
            macros.addAll(readMacros(file, macroOwner));
        }

        List<ProjectIndex> packages = new ArrayList<>();
        if (packageName == null) {
            for (Path packageRoot : installedPackages(root.resolve(spec.packagesInstallPath()))) {
                try {
                    packages.add(load(packageRoot, packageRoot.getFileName().toString()));
                } catch (ProjectLoadException e) {
                    logger.warn("Skipping package at {}: {}", packageRoot, e.getMessage());
                }
            }
        }

        return new ProjectIndex(root, spec, models, macros, packages);
    }

    DbtProjectSpec readSpec(Path projectFile) throws ProjectLoadException {
        if (!Files.isRegularFile(projectFile)) {
            throw new ProjectLoadException("Project file not found: " + projectFile);
        }
        try {
            DbtProjectSpec spec = yamlMapper.readValue(projectFile.toFile(), DbtProjectSpec.class);
            if (spec == null) {
                throw new ProjectLoadException("Project file is empty: " + projectFile);
            }
            return spec;
        } catch (IOException e) {
            throw new ProjectLoadException("Failed to read " + projectFile + ": " + e.getMessage(), e);
        }
    }

    private List<Path> sqlFiles(Path root, List<String> relativeDirectories) throws ProjectLoadException {
        List<Path> files = new ArrayList<>();
        for (String relative : relativeDirectories) {
            Path directory = root.resolve(relative).normalize();
            if (!Files.isDirectory(directory)) {
                logger.debug("Skipping missing directory {}", directory);
                continue;
            }
            try (Stream<Path> walk = Files.walk(directory)) {
                walk.filter(Files::isRegularFile)
                        .filter(file -> file.getFileName().toString().endsWith(".sql"))
                        .sorted()
                        .forEach(files::add);
            } catch (IOException e) {
                throw new ProjectLoadException("Failed to scan " + directory + ": " + e.getMessage(), e);
            }
        }
        return files;
    }

    private List<ProjectMacro> readMacros(Path file, String packageName) {
        String text;
        try {
            text = DocumentDecoder.decode(Files.readAllBytes(file));
        } catch (IOException | InvalidDocumentEncodingException e) {
            logger.warn("Skipping macro file {}: {}", file, e.getMessage());
            return List.of();
        }
        PositionFinder positions = new PositionFinder(text);
        List<ProjectMacro> macros = new ArrayList<>();
        for (MacroDefinition definition : TemplateOutline.of(Parser.parse(text).tree()).macros()) {
            macros.add(new ProjectMacro(packageName, file, definition, positions));
        }
        return macros;
    }

    private static List<Path> installedPackages(Path packagesDirectory) throws ProjectLoadException {
        if (!Files.isDirectory(packagesDirectory)) {
            return List.of();
        }
        try (Stream<Path> children = Files.list(packagesDirectory)) {
            return children.filter(child -> Files.isRegularFile(child.resolve(PROJECT_FILE))).sorted().toList();
        } catch (IOException e) {
            throw new ProjectLoadException("Failed to list packages in " + packagesDirectory + ": " + e.getMessage(), e);
        }
    }
}
