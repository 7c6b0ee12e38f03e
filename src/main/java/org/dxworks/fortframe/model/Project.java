package org.dxworks.fortframe.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * The correlated and pruned entity forest of a run, with per-kind views for presentation. Built once; every list
 * it hands out is read-only.
 */
public class Project {

    private final List<SourceFile> files;
    private final List<Module> modules = new ArrayList<>();
    private final List<Submodule> submodules = new ArrayList<>();
    private final List<Program> programs = new ArrayList<>();
    private final List<BlockData> blockData = new ArrayList<>();
    private final List<Procedure> procedures = new ArrayList<>();
    private final List<Interface> interfaces = new ArrayList<>();
    private final List<DerivedType> types = new ArrayList<>();
    private final List<Interface> absInterfaces = new ArrayList<>();
    private final List<CodeUnit> submoduleProcedures = new ArrayList<>();
    /** Lower-cased common block name to every declaration of that block, blank common under the empty name. */
    private final Map<String, List<CommonBlock>> commonBlocks = new LinkedHashMap<>();
    private final List<ExternalModule> externalModules;
    private final List<String> failedFiles;
    private final List<String> warnings;
    private final EntityArena arena;

    public Project(List<SourceFile> files, List<ExternalModule> externalModules, EntityArena arena,
                   List<String> failedFiles, List<String> warnings) {
        this.files = List.copyOf(files);
        this.externalModules = List.copyOf(externalModules);
        this.arena = arena;
        this.failedFiles = List.copyOf(failedFiles);
        this.warnings = List.copyOf(warnings);

        for (SourceFile file : files) {
            modules.addAll(file.modules);
            submodules.addAll(file.submodules);
            programs.addAll(file.programs);
            blockData.addAll(file.blockData);
            procedures.addAll(file.procedures());
        }
        List<CodeUnit> units = new ArrayList<>(modules);
        units.addAll(submodules);
        for (CodeUnit unit : units) {
            procedures.addAll(unit.procedures());
            interfaces.addAll(unit.interfaces);
            types.addAll(unit.types);
            absInterfaces.addAll(unit.absInterfaces);
        }
        for (Program program : programs) {
            types.addAll(program.types);
            absInterfaces.addAll(program.absInterfaces);
        }
        for (BlockData unit : blockData) {
            types.addAll(unit.types);
        }
        for (Submodule submodule : submodules) {
            submoduleProcedures.addAll(submodule.modProcedures);
            for (Procedure procedure : submodule.procedures()) {
                if (procedure.separateModuleProcedure) {
                    submoduleProcedures.add(procedure);
                }
            }
        }
        for (Entity entity : arena.entities()) {
            if (entity instanceof CommonBlock commonBlock) {
                commonBlocks.computeIfAbsent(commonBlock.getLowerName(), key -> new ArrayList<>()).add(commonBlock);
            }
        }
    }

    public List<SourceFile> getFiles() {
        return files;
    }

    public List<Module> getModules() {
        return Collections.unmodifiableList(modules);
    }

    public List<Submodule> getSubmodules() {
        return Collections.unmodifiableList(submodules);
    }

    public List<Program> getPrograms() {
        return Collections.unmodifiableList(programs);
    }

    public List<BlockData> getBlockData() {
        return Collections.unmodifiableList(blockData);
    }

    /** Free procedures and the procedures of modules and submodules. */
    public List<Procedure> getProcedures() {
        return Collections.unmodifiableList(procedures);
    }

    public List<Interface> getInterfaces() {
        return Collections.unmodifiableList(interfaces);
    }

    public List<DerivedType> getTypes() {
        return Collections.unmodifiableList(types);
    }

    public List<Interface> getAbsInterfaces() {
        return Collections.unmodifiableList(absInterfaces);
    }

    public List<CodeUnit> getSubmoduleProcedures() {
        return Collections.unmodifiableList(submoduleProcedures);
    }

    /**
     * Every declaration of the named common block across the project, in file order. Blank common is found under
     * the empty name.
     */
    public List<CommonBlock> getCommonBlocks(String name) {
        return Collections.unmodifiableList(commonBlocks.getOrDefault(name.strip().toLowerCase(Locale.ROOT), List.of()));
    }

    public List<String> getCommonBlockNames() {
        return List.copyOf(commonBlocks.keySet());
    }

    public List<ExternalModule> getExternalModules() {
        return externalModules;
    }

    public List<String> getFailedFiles() {
        return failedFiles;
    }

    public List<String> getWarnings() {
        return warnings;
    }

    public Entity getEntity(int handle) {
        return arena.get(handle);
    }

    public int getEntityCount() {
        return arena.size();
    }

    public Module findModule(String name) {
        for (Module module : modules) {
            if (module.getName().equalsIgnoreCase(name)) {
                return module;
            }
        }
        return null;
    }
}
