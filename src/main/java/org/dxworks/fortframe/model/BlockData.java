package org.dxworks.fortframe.model;

/**
 * A {@code block data} unit. It only declares variables, types and common blocks, and initializes the common
 * blocks outside any executing unit. An unnamed unit has an empty name.
 */
public class BlockData extends CodeUnit {

    public BlockData(String name, Entity parent) {
        super(name, parent, Permission.PUBLIC);
    }

    @Override
    public EntityKind getKind() {
        return EntityKind.BLOCK_DATA;
    }

    @Override
    public <R> R accept(EntityVisitor<R> visitor) {
        return visitor.visitBlockData(this);
    }
}
