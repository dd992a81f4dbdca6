package org.lakeshift.migration.differs;

import org.lakeshift.model.Change;
import org.lakeshift.model.ChangeDetail;
import org.lakeshift.model.TableModel;

import java.util.HashSet;
import java.util.List;

public class ClusteringDiffer implements TableComponentDiffer {

    @Override
    public void diff(TableModel source, TableModel target, List<Change> changes) {
        if (new HashSet<>(source.getLiquidClustering()).equals(new HashSet<>(target.getLiquidClustering()))) {
            return;
        }
        // target 선언 순서를 그대로 유지 (빈 리스트 = clustering 제거)
        changes.add(Change.of(target.getName(), new ChangeDetail.AlterClustering(
                List.copyOf(source.getLiquidClustering()), List.copyOf(target.getLiquidClustering()))));
    }
}
