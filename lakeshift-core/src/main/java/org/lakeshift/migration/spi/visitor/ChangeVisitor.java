package org.lakeshift.migration.spi.visitor;

import org.lakeshift.model.Change;
import org.lakeshift.model.ChangeDetail;

/**
 * One method per change kind. Adding a kind to {@link ChangeDetail} without a matching
 * method here does not compile.
 */
public interface ChangeVisitor<R> {
    // Table
    R visitCreateTable(Change change, ChangeDetail.CreateTable detail);
    R visitDropTable(Change change, ChangeDetail.DropTable detail);

    // Column
    R visitAddColumn(Change change, ChangeDetail.AddColumn detail);
    R visitDropColumn(Change change, ChangeDetail.DropColumn detail);
    R visitAlterColumnType(Change change, ChangeDetail.AlterColumnType detail);
    R visitAlterColumnNullability(Change change, ChangeDetail.AlterColumnNullability detail);
    R visitAlterColumnDefault(Change change, ChangeDetail.AlterColumnDefault detail);

    // Keys
    R visitSetPrimaryKey(Change change, ChangeDetail.SetPrimaryKey detail);
    R visitDropPrimaryKey(Change change, ChangeDetail.DropPrimaryKey detail);
    R visitAddForeignKey(Change change, ChangeDetail.AddForeignKey detail);
    R visitDropForeignKey(Change change, ChangeDetail.DropForeignKey detail);

    // Check constraints
    R visitAddCheckConstraint(Change change, ChangeDetail.AddCheckConstraint detail);
    R visitDropCheckConstraint(Change change, ChangeDetail.DropCheckConstraint detail);

    // Layout & properties
    R visitAlterClustering(Change change, ChangeDetail.AlterClustering detail);
    R visitAlterPartitioning(Change change, ChangeDetail.AlterPartitioning detail);
    R visitAlterTableProperties(Change change, ChangeDetail.AlterTableProperties detail);
}
