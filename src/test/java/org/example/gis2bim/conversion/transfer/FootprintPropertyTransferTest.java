package org.example.gis2bim.conversion.transfer;

import org.example.gis2bim.conversion.attribute.AttributeValue;
import org.example.gis2bim.conversion.io.StepModel;
import org.example.gis2bim.conversion.style.ResolvedStyle;
import org.example.gis2bim.conversion.style.RgbColor;
import org.example.gis2bim.conversion.style.StyleCondition;
import org.example.gis2bim.conversion.style.StyleResolver;
import org.example.gis2bim.conversion.style.StyleRule;
import org.example.gis2bim.conversion.style.StyleTable;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class FootprintPropertyTransferTest {

    private static final ResolvedStyle GREY = ResolvedStyle.defaultStyle(RgbColor.of(0.7, 0.7, 0.7), "Unclassified");

    static final String FOOTPRINT = """
            ISO-10303-21;
            HEADER;
            FILE_DESCRIPTION(('ViewDefinition [CoordinationView]'),'2;1');
            FILE_NAME('Bygning.ifc','2026-01-21T00:00:00',(''),(''),'gis2bim 1.0.0','gis2bim','');
            FILE_SCHEMA(('IFC2X3'));
            ENDSEC;
            DATA;
            #1=IFCOWNERHISTORY($,$,$,.ADDED.,$,$,$,0);
            #10=IFCCARTESIANPOINT((0.,0.,0.));
            #11=IFCAXIS2PLACEMENT3D(#10,$,$);
            #12=IFCLOCALPLACEMENT($,#11);
            #13=IFCDIRECTION((0.,0.,1.));
            #20=IFCBUILDINGELEMENTPROXY('1fpBuildingA0000000001',#1,'buildings#0',$,$,#12,#29,$,$);
            #21=IFCCARTESIANPOINT((0.,0.));
            #22=IFCCARTESIANPOINT((10.,0.));
            #23=IFCCARTESIANPOINT((10.,10.));
            #24=IFCCARTESIANPOINT((0.,10.));
            #25=IFCPOLYLINE((#21,#22,#23,#24,#21));
            #26=IFCARBITRARYCLOSEDPROFILEDEF(.AREA.,$,#25);
            #27=IFCEXTRUDEDAREASOLID(#26,#11,#13,0.1);
            #28=IFCSHAPEREPRESENTATION($,'Body','SweptSolid',(#27));
            #29=IFCPRODUCTDEFINITIONSHAPE($,$,(#28));
            #30=IFCSIUNIT(*,.LENGTHUNIT.,$,.METRE.);
            #31=IFCPROPERTYSINGLEVALUE('bygningstype',$,IFCINTEGER(111),$);
            #32=IFCPROPERTYSINGLEVALUE('navn',$,IFCLABEL('R\\X2\\00E5\\X0\\dhus'),#30);
            #33=IFCPROPERTYSET('1fpPset000000000000001',#1,'GIS_Attributes',$,(#31,#32));
            #34=IFCRELDEFINESBYPROPERTIES('1fpRel0000000000000001',#1,$,$,(#20),#33);
            #35=IFCPROPERTYSINGLEVALUE('Reference',$,IFCIDENTIFIER('A-1'),$);
            #36=IFCPROPERTYSET('1fpPset000000000000002',#1,'Pset_BuildingElementProxyCommon',$,(#35));
            #37=IFCRELDEFINESBYPROPERTIES('1fpRel0000000000000002',#1,$,$,(#20),#36);
            #40=IFCBUILDINGELEMENTPROXY('1fpBuildingB0000000001',#1,'buildings#1',$,$,#41,#29,$,$);
            #41=IFCLOCALPLACEMENT($,#43);
            #42=IFCCARTESIANPOINT((100.,100.,0.));
            #43=IFCAXIS2PLACEMENT3D(#42,$,$);
            ENDSEC;
            END-ISO-10303-21;
            """;

    static final String TARGET = """
            ISO-10303-21;
            HEADER;
            FILE_DESCRIPTION(('ViewDefinition [CoordinationView]'),'2;1');
            FILE_NAME('bygninger.ifc','2026-01-21T00:00:00',(''),(''),'modeller','modeller','');
            FILE_SCHEMA(('IFC2X3'));
            ENDSEC;
            DATA;
            #1=IFCOWNERHISTORY($,$,$,.ADDED.,$,$,$,0);
            #10=IFCCARTESIANPOINT((0.,0.,0.));
            #11=IFCAXIS2PLACEMENT3D(#10,$,$);
            #12=IFCLOCALPLACEMENT($,#11);
            #13=IFCCARTESIANPOINT((4.,4.,0.));
            #14=IFCAXIS2PLACEMENT3D(#13,$,$);
            #15=IFCLOCALPLACEMENT(#12,#14);
            #20=IFCBUILDINGELEMENTPROXY('2tgtHouse000000000001',#1,'house',$,$,#15,#25,$,$);
            #21=IFCAXIS2PLACEMENT2D(#22,$);
            #22=IFCCARTESIANPOINT((0.,0.));
            #23=IFCRECTANGLEPROFILEDEF(.AREA.,$,#21,4.,4.);
            #24=IFCDIRECTION((0.,0.,1.));
            #26=IFCEXTRUDEDAREASOLID(#23,#11,#24,6.);
            #27=IFCSHAPEREPRESENTATION($,'Body','SweptSolid',(#26));
            #25=IFCPRODUCTDEFINITIONSHAPE($,$,(#27));
            #28=IFCSTYLEDITEM(#26,(#29),'old');
            #29=IFCPRESENTATIONSTYLEASSIGNMENT(());
            #30=IFCPROPERTYSINGLEVALUE('floors',$,IFCINTEGER(2),$);
            #31=IFCPROPERTYSET('3tgtPset00000000000001',#1,'Existing',$,(#30));
            #32=IFCRELDEFINESBYPROPERTIES('3tgtRel000000000000001',#1,$,$,(#20),#31);
            #40=IFCCARTESIANPOINT((50.,50.,0.));
            #41=IFCCARTESIANPOINT((52.,50.,0.));
            #42=IFCCARTESIANPOINT((50.,52.,0.));
            #43=IFCCARTESIANPOINT((50.,50.,2.));
            #44=IFCPOLYLOOP((#40,#42,#41));
            #45=IFCPOLYLOOP((#40,#41,#43));
            #46=IFCPOLYLOOP((#41,#42,#43));
            #47=IFCPOLYLOOP((#42,#40,#43));
            #48=IFCFACEOUTERBOUND(#44,.T.);
            #49=IFCFACEOUTERBOUND(#45,.T.);
            #50=IFCFACEOUTERBOUND(#46,.T.);
            #51=IFCFACEOUTERBOUND(#47,.T.);
            #52=IFCFACE((#48));
            #53=IFCFACE((#49));
            #54=IFCFACE((#50));
            #55=IFCFACE((#51));
            #56=IFCCLOSEDSHELL((#52,#53,#54,#55));
            #57=IFCFACETEDBREP(#56);
            #58=IFCSHAPEREPRESENTATION($,'Body','Brep',(#57));
            #59=IFCPRODUCTDEFINITIONSHAPE($,$,(#58));
            #60=IFCBUILDINGELEMENTPROXY('2tgtShed0000000000001',#1,'shed',$,$,#12,#59,$,$);
            #70=IFCOPENINGELEMENT('2tgtOpening00000000001',#1,$,$,$,#15,#25,$);
            ENDSEC;
            END-ISO-10303-21;
            """;

    private final FootprintPropertyTransfer transfer = new FootprintPropertyTransfer(new StyleResolver());

    @Test
    void transfer_copiesPropertiesToOverlappingTargetAndRestyles() {
        StepModel target = StepModel.parse(TARGET);

        TransferReport report = transfer.transfer(StepModel.parse(FOOTPRINT), target, residentialStyles());

        assertThat(report.footprintCount()).isEqualTo(2);
        assertThat(report.targetCount()).isEqualTo(2);
        assertThat(report.matchedFootprints()).isEqualTo(1);
        assertThat(report.matchCount()).isEqualTo(1);
        assertThat(report.copiedPropertySets()).isEqualTo(1);
        assertThat(report.styledElements()).isEqualTo(1);
        assertThat(report.unmatchedFootprints()).containsExactly("1fpBuildingB0000000001");
        assertThat(report.warnings()).isEmpty();

        String text = target.toStepText();
        assertThat(text).contains("FILE_NAME('bygninger.ifc'", "#70=IFCOPENINGELEMENT(");
        StepModel result = StepModel.parse(text);

        List<StepModel.Entity> propertySets = result.ofType("IFCPROPERTYSET");
        assertThat(propertySets).extracting(e -> e.stringArg(2)).containsExactly("Existing", "GIS_Attributes");
        StepModel.Entity copied = propertySets.get(1);
        assertThat(copied.arg(1)).isEqualTo("#1");
        List<List<String>> properties = copied.refListArg(4).stream()
                .map(id -> result.get(id).orElseThrow().args())
                .toList();
        assertThat(properties).containsExactly(
                List.of("'bygningstype'", "$", "IFCINTEGER(111)", "$"),
                List.of("'navn'", "$", "IFCLABEL('R\\X2\\00E5\\X0\\dhus')", "$"));

        List<StepModel.Entity> relations = result.ofType("IFCRELDEFINESBYPROPERTIES");
        StepModel.Entity relation = relations.get(relations.size() - 1);
        assertThat(relation.refListArg(4)).containsExactly(20);
        assertThat(relation.refArg(5)).isEqualTo(copied.id());

        List<StepModel.Entity> styledItems = result.ofType("IFCSTYLEDITEM");
        assertThat(styledItems).hasSize(1);
        StepModel.Entity styled = styledItems.get(0);
        assertThat(styled.id()).isEqualTo(28);
        assertThat(styled.refArg(0)).isEqualTo(26);
        assertThat(styled.stringArg(2)).isEqualTo("old");
        StepModel.Entity assignment = result.get(styled.refListArg(1).get(0)).orElseThrow();
        StepModel.Entity surfaceStyle = result.get(assignment.refListArg(0).get(0)).orElseThrow();
        assertThat(surfaceStyle.type()).isEqualTo("IFCSURFACESTYLE");
        assertThat(surfaceStyle.stringArg(0)).isEqualTo("Bolig");
    }

    @Test
    void transfer_withoutMatchingRuleCopiesButDoesNotRestyle() {
        StepModel target = StepModel.parse(TARGET);

        TransferReport report = transfer.transfer(StepModel.parse(FOOTPRINT), target, StyleTable.empty(GREY));

        assertThat(report.copiedPropertySets()).isEqualTo(1);
        assertThat(report.styledElements()).isZero();
        StepModel result = StepModel.parse(target.toStepText());
        assertThat(result.get(28).orElseThrow().args()).containsExactly("#26", "(#29)", "'old'");
        assertThat(result.ofType("IFCSURFACESTYLE")).isEmpty();
    }

    @Test
    void transfer_unstyledTargetGetsNewStyledItem() {
        String unstyled = TARGET.replace("#28=IFCSTYLEDITEM(#26,(#29),'old');\n", "");
        StepModel target = StepModel.parse(unstyled);

        transfer.transfer(StepModel.parse(FOOTPRINT), target, residentialStyles());

        List<StepModel.Entity> styledItems = StepModel.parse(target.toStepText()).ofType("IFCSTYLEDITEM");
        assertThat(styledItems).hasSize(1);
        assertThat(styledItems.get(0).refArg(0)).isEqualTo(26);
        assertThat(styledItems.get(0).id()).isGreaterThan(70);
    }

    @Test
    void transfer_reportsProductsWithUnsupportedGeometry() {
        String csg = TARGET.replace("#57=IFCFACETEDBREP(#56);", "#57=IFCCSGSOLID(#56);");

        TransferReport report = transfer.transfer(StepModel.parse(FOOTPRINT), StepModel.parse(csg), residentialStyles());

        assertThat(report.targetCount()).isEqualTo(1);
        assertThat(report.matchCount()).isEqualTo(1);
        assertThat(report.warnings()).singleElement().asString().contains("IFCCSGSOLID");
    }

    @Test
    void transfer_readsAndWritesFiles(@TempDir Path dir) throws Exception {
        Path footprint = Files.writeString(dir.resolve("Bygning.ifc"), FOOTPRINT, StandardCharsets.ISO_8859_1);
        Path target = Files.writeString(dir.resolve("bygninger.ifc"), TARGET, StandardCharsets.ISO_8859_1);

        TransferReport report = transfer.transfer(footprint, target, target, residentialStyles());

        assertThat(report.copiedPropertySets()).isEqualTo(1);
        String written = Files.readString(target, StandardCharsets.ISO_8859_1);
        assertThat(written).contains("'GIS_Attributes'").endsWith("END-ISO-10303-21;\n");
        assertThat(StepModel.parse(written).ofType("IFCPROPERTYSET")).hasSize(2);
    }

    @Test
    void isIgnoredPropertySet_matchesKnownPrefixes() {
        assertThat(FootprintPropertyTransfer.isIgnoredPropertySet("Pset_WallCommon")).isTrue();
        assertThat(FootprintPropertyTransfer.isIgnoredPropertySet("Qto_BuildingBaseQuantities")).isTrue();
        assertThat(FootprintPropertyTransfer.isIgnoredPropertySet("BaseQuantities")).isTrue();
        assertThat(FootprintPropertyTransfer.isIgnoredPropertySet("CommonAttributes")).isTrue();
        assertThat(FootprintPropertyTransfer.isIgnoredPropertySet("GIS_Attributes")).isFalse();
        assertThat(FootprintPropertyTransfer.isIgnoredPropertySet(null)).isFalse();
    }

    private static StyleTable residentialStyles() {
        StyleRule residential = new StyleRule("bolig",
                List.of(new StyleCondition("bygningstype", AttributeValue.integer(111))),
                RgbColor.parseHex("#CC3333"), "Bolig", 0, 0);
        return new StyleTable(List.of(residential), GREY);
    }
}
