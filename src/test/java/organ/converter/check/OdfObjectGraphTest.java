package organ.converter.check;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.List;

import org.junit.jupiter.api.Test;

import organ.converter.graph.TargetStore;
import organ.converter.model.ConversionLog;

class OdfObjectGraphTest {

    private final ConversionLog log = new ConversionLog();

    private static TargetStore smallOrgan() {
        final TargetStore target = new TargetStore();
        target.createReserved("Organ");
        target.createReserved("Panel000").set("NumberOfGUIElements", 1);
        target.create("Panel000Element").set("Type", "Manual").set("Manual", "001");
        target.create("WindchestGroup").set("Name", "Main");
        target.create("Manual").set("NumberOfStops", 1).set("Stop001", "001");
        target.create("Stop").set("NumberOfRanks", 1).set("Rank001", "001").set("Switch001", "001");
        target.create("Rank").set("WindchestGroup", "001");
        target.create("Switch").set("Name", "Principal");
        return target;
    }

    @Test
    void referencesBecomeParentEdges() {
        final OdfObjectGraph graph = OdfObjectGraph.build(smallOrgan().all(), log);

        assertThat(graph.childrenOf("Organ")).containsExactlyInAnyOrder("Panel000", "WindchestGroup001", "Manual001");
        assertThat(graph.parentsOf("Stop001")).containsExactly("Manual001");
        assertThat(graph.parentsOf("Rank001")).containsExactlyInAnyOrder("Stop001", "WindchestGroup001");
        assertThat(graph.parentsOf("Switch001")).containsExactly("Stop001");
        assertThat(graph.childrenOf("Panel000Element001")).containsExactly("Manual001");
        assertThat(graph.unresolvedReferences()).isEmpty();
        assertThat(graph.unusedObjects()).isEmpty();
        assertThat(log.entries()).isEmpty();
    }

    @Test
    void danglingReferenceIsAnError() {
        final TargetStore target = smallOrgan();
        target.get("Stop001").set("Rank002", "007");

        final OdfObjectGraph graph = OdfObjectGraph.build(target.all(), log);
        assertThat(graph.unresolvedReferences()).containsExactly("Stop001.Rank002 -> Rank007");
        assertThat(log.count(ConversionLog.Severity.ERROR)).isEqualTo(1);
    }

    @Test
    void unreferencedObjectIsReportedAsUnused() {
        final TargetStore target = smallOrgan();
        target.create("Switch").set("Name", "Orphan");

        final OdfObjectGraph graph = OdfObjectGraph.build(target.all(), log);
        assertThat(graph.unusedObjects()).containsExactly("Switch002");
        assertThat(log.contains(ConversionLog.Severity.WARNING, "Switch002: not used")).isTrue();
    }

    @Test
    void destinationManualMayNameTheReservedPedal() {
        final TargetStore target = smallOrgan();
        target.createReserved("Manual000");
        target.create("Coupler").set("DestinationManual", "000");
        target.get("Manual001").set("NumberOfCouplers", 1).set("Coupler001", "001");

        final OdfObjectGraph graph = OdfObjectGraph.build(target.all(), log);
        assertThat(graph.unresolvedReferences()).isEmpty();
    }

    @Test
    void treeStartsAtOrganAndListsUnusedRoots() {
        final TargetStore target = smallOrgan();
        target.create("Switch");

        final List<OdfObjectGraph.Node> tree = OdfObjectGraph.build(target.all(), log).tree();
        assertThat(tree).extracting(OdfObjectGraph.Node::id).containsExactly("Organ", "Switch002");
        assertThat(tree.get(0).children()).extracting(OdfObjectGraph.Node::id)
                .containsExactly("Panel000", "WindchestGroup001", "Manual001");
    }
}
