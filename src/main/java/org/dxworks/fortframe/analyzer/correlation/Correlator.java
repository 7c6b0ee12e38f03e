package org.dxworks.fortframe.analyzer.correlation;

import org.dxworks.fortframe.Diagnostics;
import org.dxworks.fortframe.FortframeConfig;
import org.dxworks.fortframe.model.DocMetadata;
import org.dxworks.fortframe.model.Entity;
import org.dxworks.fortframe.model.EntityArena;
import org.dxworks.fortframe.model.ExternalModule;
import org.dxworks.fortframe.model.Module;
import org.dxworks.fortframe.model.Program;
import org.dxworks.fortframe.model.Project;
import org.dxworks.fortframe.model.SourceFile;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Whole-project pass over the parsed files: resolves use statements, orders modules by dependency, correlates
 * every unit in that order, prunes what is not displayed, assigns identifiers and freezes the result.
 */
public class Correlator {

    private final FortframeConfig config;
    private final Diagnostics diagnostics;

    public Correlator(FortframeConfig config, Diagnostics diagnostics) {
        this.config = config;
        this.diagnostics = diagnostics;
    }

    /**
     * @throws DependencyCycleException   when modules use each other in a cycle
     * @throws DuplicateProgramException when two programs share a name
     */
    public Project correlate(List<SourceFile> files, List<String> failedFiles) {
        diagnostics.info("Correlating information from " + files.size() + " files...");
        for (SourceFile file : files) {
            extractMetadata(file);
        }
        checkDuplicatePrograms(files);

        ModuleResolver resolver = new ModuleResolver(files, IntrinsicModules.forConfig(config), diagnostics);
        for (SourceFile file : files) {
            resolver.resolve(file);
        }

        ScopeCorrelator correlator = new ScopeCorrelator(diagnostics);
        for (Entity entity : correlationOrder(files)) {
            entity.accept(correlator);
        }

        Pruner pruner = new Pruner(config.getDisplay(), config.isHideUndoc(), config.isProcInternals());
        for (SourceFile file : files) {
            pruner.prune(file);
        }

        IdentifierAssigner identifiers = new IdentifierAssigner();
        identifiers.assign(files);
        List<ExternalModule> externals = resolver.getUsedExternals();
        externals.forEach(identifiers::assignExternal);

        EntityArena arena = new EntityArena();
        for (SourceFile file : files) {
            arena.registerTree(file);
        }
        externals.forEach(arena::register);
        for (Entity entity : arena.entities()) {
            entity.freeze();
        }
        return new Project(files, externals, arena, failedFiles, diagnostics.getWarnings());
    }

    /**
     * Modules and submodules in dependency order, then file-level procedures, then programs, then block data
     * units.
     */
    List<Entity> correlationOrder(List<SourceFile> files) {
        List<Module> units = new ArrayList<>();
        for (SourceFile file : files) {
            units.addAll(file.modules);
            units.addAll(file.submodules);
        }
        List<Entity> order = new ArrayList<>(new DependencyGraph(units).order());
        for (SourceFile file : files) {
            order.addAll(file.procedures());
        }
        for (SourceFile file : files) {
            order.addAll(file.programs);
        }
        for (SourceFile file : files) {
            order.addAll(file.blockData);
        }
        return order;
    }

    private static void extractMetadata(Entity entity) {
        DocMetadata.extract(entity);
        for (Entity child : entity.children()) {
            extractMetadata(child);
        }
    }

    private static void checkDuplicatePrograms(List<SourceFile> files) {
        Map<String, Program> programs = new HashMap<>();
        for (SourceFile file : files) {
            for (Program program : file.programs) {
                Program previous = programs.putIfAbsent(program.getLowerName(), program);
                if (previous != null) {
                    throw new DuplicateProgramException(program.getName(),
                            previous.getSourceFile().getName(), file.getName());
                }
            }
        }
    }
}
