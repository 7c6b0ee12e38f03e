package org.dxworks.fortframe.model;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

public class SourceFile extends Entity {
    public final Path path;
    public final String rawText;
    public List<Module> modules = new ArrayList<>();
    public List<Submodule> submodules = new ArrayList<>();
    public List<Program> programs = new ArrayList<>();
    public List<BlockData> blockData = new ArrayList<>();
    public List<Function> functions = new ArrayList<>();
    public List<Subroutine> subroutines = new ArrayList<>();

    public SourceFile(Path path, String rawText) {
        super(path.getFileName().toString(), null, Permission.PUBLIC);
        this.path = path;
        this.rawText = rawText;
    }

    @Override
    public EntityKind getKind() {
        return EntityKind.SOURCE_FILE;
    }

    @Override
    public <R> R accept(EntityVisitor<R> visitor) {
        return visitor.visitSourceFile(this);
    }

    @Override
    public List<Entity> children() {
        return concat(modules, submodules, programs, blockData, functions, subroutines);
    }

    public List<Procedure> procedures() {
        List<Procedure> procedures = new ArrayList<>(functions);
        procedures.addAll(subroutines);
        return procedures;
    }

    @Override
    public void freeze() {
        super.freeze();
        modules = frozen(modules);
        submodules = frozen(submodules);
        programs = frozen(programs);
        blockData = frozen(blockData);
        functions = frozen(functions);
        subroutines = frozen(subroutines);
    }
}
