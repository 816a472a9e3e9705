package org.example.gis2bim.conversion.model;

import org.example.gis2bim.conversion.attribute.PropertySet;
import org.example.gis2bim.conversion.geometry.Box;
import org.example.gis2bim.conversion.geometry.Placement;
import org.example.gis2bim.conversion.geometry.Vector3;
import org.example.gis2bim.conversion.style.ResolvedStyle;
import org.example.gis2bim.conversion.style.RgbColor;
import org.junit.jupiter.api.Test;

import java.util.HashSet;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ModelAssemblerTest {

    private static final ResolvedStyle STYLE = ResolvedStyle.defaultStyle(RgbColor.of(0.5, 0.5, 0.5), "Unclassified");

    @Test
    void constructor_createsProjectSiteBuildingChain() {
        ModelAssembler assembler = new ModelAssembler(ProjectInfo.named("Demo"));

        ModelGraph graph = assembler.finish();

        assertThat(graph.project().kind()).isEqualTo(HierarchyNode.Kind.PROJECT);
        assertThat(graph.project().name()).isEqualTo("Demo");
        assertThat(graph.project().children()).containsExactly(graph.site());
        assertThat(graph.site().children()).containsExactly(graph.building());
        assertThat(graph.building().parent()).isSameAs(graph.site());
        assertThat(graph.layers()).isEmpty();
        assertThat(graph.elementCount()).isZero();
    }

    @Test
    void getOrCreateGroup_returnsSameNodeForSameKey() {
        ModelAssembler assembler = new ModelAssembler(ProjectInfo.named("Demo"));

        HierarchyNode roads = assembler.getOrCreateGroup("roads");
        HierarchyNode again = assembler.getOrCreateGroup("roads");
        HierarchyNode parcels = assembler.getOrCreateGroup("parcels");

        assertThat(again).isSameAs(roads);
        assertThat(roads.kind()).isEqualTo(HierarchyNode.Kind.LAYER);
        assertThat(assembler.finish().layers()).containsExactly(roads, parcels);
        assertThat(roads.globalId()).isNotEqualTo(parcels.globalId());
    }

    @Test
    void constructor_idSeedSeparatesRunsWithSameProjectName() {
        Set<String> first = ids(new ModelAssembler(ProjectInfo.named("Demo"), "Bygning.ifc"));
        Set<String> repeat = ids(new ModelAssembler(ProjectInfo.named("Demo"), "Bygning.ifc"));
        Set<String> other = ids(new ModelAssembler(ProjectInfo.named("Demo"), "Vei.ifc"));

        assertThat(repeat).isEqualTo(first);
        assertThat(other).doesNotContainAnyElementsOf(first);
    }

    @Test
    void getOrCreateGroup_rejectsNullKey() {
        ModelAssembler assembler = new ModelAssembler(ProjectInfo.named("Demo"));

        assertThatThrownBy(() -> assembler.getOrCreateGroup(null)).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void addElement_keepsDuplicatesAndAttachesToGroup() {
        ModelAssembler assembler = new ModelAssembler(ProjectInfo.named("Demo"));
        HierarchyNode group = assembler.getOrCreateGroup("trees");

        ModelElement first = element(assembler, group, 0);
        ModelElement second = element(assembler, group, 0);
        assembler.addElement("trees", first);
        assembler.addElement("trees", second);
        ModelGraph graph = assembler.finish();

        assertThat(group.elements()).containsExactly(first, second);
        assertThat(graph.elements()).containsExactly(first, second);
        assertThat(graph.elementCount()).isEqualTo(2);
    }

    @Test
    void addElement_rejectsUnknownOrMismatchedGroup() {
        ModelAssembler assembler = new ModelAssembler(ProjectInfo.named("Demo"));
        HierarchyNode trees = assembler.getOrCreateGroup("trees");
        assembler.getOrCreateGroup("roads");
        ModelElement tree = element(assembler, trees, 0);

        assertThatThrownBy(() -> assembler.addElement("unknown", tree)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> assembler.addElement("roads", tree)).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void nextGlobalId_isUniqueAndReproducible() {
        ModelAssembler a = new ModelAssembler(ProjectInfo.named("Demo"));
        ModelAssembler b = new ModelAssembler(ProjectInfo.named("Demo"));
        Set<String> ids = new HashSet<>();

        for (int i = 0; i < 100; i++) {
            String id = a.nextGlobalId();
            assertThat(IfcGuid.isValid(id)).isTrue();
            assertThat(ids.add(id)).isTrue();
            assertThat(b.nextGlobalId()).isEqualTo(id);
        }
    }

    @Test
    void finish_forbidsFurtherMutation() {
        ModelAssembler assembler = new ModelAssembler(ProjectInfo.named("Demo"));
        HierarchyNode group = assembler.getOrCreateGroup("trees");
        ModelElement tree = element(assembler, group, 0);
        assembler.finish();

        assertThat(assembler.isFinished()).isTrue();
        assertThatThrownBy(() -> assembler.addElement("trees", tree))
                .isInstanceOf(InvalidStateException.class)
                .hasMessageContaining("addElement");
        assertThatThrownBy(() -> assembler.getOrCreateGroup("x")).isInstanceOf(InvalidStateException.class);
        assertThatThrownBy(assembler::nextGlobalId).isInstanceOf(InvalidStateException.class);
        assertThatThrownBy(assembler::finish).isInstanceOf(InvalidStateException.class);
    }

    @Test
    void projectInfo_requiresName() {
        assertThatThrownBy(() -> ProjectInfo.named(" ")).isInstanceOf(IllegalArgumentException.class);
    }

    private static ModelElement element(ModelAssembler assembler, HierarchyNode group, int index) {
        return new ModelElement(assembler.nextGlobalId(), group.key() + "#" + index,
                new Box(1, 1, 1, Placement.at(Vector3.ZERO)), STYLE, PropertySet.empty("GIS_Attributes"),
                group, group.key(), index);
    }

    private static Set<String> ids(ModelAssembler assembler) {
        HierarchyNode group = assembler.getOrCreateGroup("trees");
        String element = assembler.nextGlobalId();
        ModelGraph graph = assembler.finish();
        return Set.of(graph.project().globalId(), graph.site().globalId(), graph.building().globalId(),
                group.globalId(), element);
    }
}
