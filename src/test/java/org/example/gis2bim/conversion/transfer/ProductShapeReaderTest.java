package org.example.gis2bim.conversion.transfer;

import org.example.gis2bim.conversion.geometry.Vector3;
import org.example.gis2bim.conversion.io.StepModel;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class ProductShapeReaderTest {

    private final ProductShapeReader reader = new ProductShapeReader();

    @Test
    void read_extrusionFollowsRotatedPlacementChain() {
        StepModel model = model("""
                #1=IFCCARTESIANPOINT((10.,0.,0.));
                #2=IFCDIRECTION((0.,0.,1.));
                #3=IFCDIRECTION((0.,1.,0.));
                #4=IFCAXIS2PLACEMENT3D(#1,#2,#3);
                #5=IFCLOCALPLACEMENT($,#4);
                #6=IFCCARTESIANPOINT((2.,0.,0.));
                #7=IFCAXIS2PLACEMENT3D(#6,$,$);
                #8=IFCLOCALPLACEMENT(#5,#7);
                #9=IFCRECTANGLEPROFILEDEF(.AREA.,$,$,2.,4.);
                #10=IFCEXTRUDEDAREASOLID(#9,$,#2,3.);
                #11=IFCSHAPEREPRESENTATION($,'Axis','Curve2D',(#10));
                #12=IFCSHAPEREPRESENTATION($,'Body','SweptSolid',(#10));
                #13=IFCPRODUCTDEFINITIONSHAPE($,$,(#11,#12));
                #14=IFCWALL('wall',$,$,$,$,#8,#13,$);
                """);
        List<String> warnings = new ArrayList<>();

        List<ProductShape> shapes = reader.read(model, warnings);

        assertThat(warnings).isEmpty();
        assertThat(shapes).singleElement().satisfies(shape -> {
            assertThat(shape.entityId()).isEqualTo(14);
            assertThat(shape.globalId()).isEqualTo("wall");
            assertThat(shape.type()).isEqualTo("IFCWALL");
            assertClose(shape.centroid(), 10.0, 2.0, 1.5);
            assertClose(shape.bounds().min(), 8.0, 1.0, 0.0);
            assertClose(shape.bounds().max(), 12.0, 3.0, 3.0);
        });
    }

    @Test
    void read_sweptDiskExpandsCentrelineByRadius() {
        StepModel model = model("""
                #1=IFCAXIS2PLACEMENT3D(#2,$,$);
                #2=IFCCARTESIANPOINT((0.,0.,0.));
                #3=IFCLOCALPLACEMENT($,#1);
                #4=IFCCARTESIANPOINT((10.,0.,0.));
                #5=IFCPOLYLINE((#2,#4));
                #6=IFCSWEPTDISKSOLID(#5,0.5,$,$,$);
                #7=IFCSHAPEREPRESENTATION($,'Body','AdvancedSweptSolid',(#6));
                #8=IFCPRODUCTDEFINITIONSHAPE($,$,(#7));
                #9=IFCFLOWSEGMENT('pipe',$,$,$,$,#3,#8,$);
                """);

        List<ProductShape> shapes = reader.read(model, new ArrayList<>());

        assertThat(shapes).singleElement().satisfies(shape -> {
            assertClose(shape.centroid(), 5.0, 0.0, 0.0);
            assertClose(shape.bounds().min(), -0.5, -0.5, -0.5);
            assertClose(shape.bounds().max(), 10.5, 0.5, 0.5);
        });
    }

    @Test
    void read_mappedItemAppliesScaledOperator() {
        StepModel model = model("""
                #1=IFCCARTESIANPOINT((0.,0.,0.));
                #2=IFCAXIS2PLACEMENT3D(#1,$,$);
                #3=IFCLOCALPLACEMENT($,#2);
                #4=IFCCARTESIANPOINT((1.,0.,0.));
                #5=IFCCARTESIANPOINT((0.,1.,0.));
                #6=IFCPOLYLOOP((#1,#4,#5));
                #7=IFCFACEOUTERBOUND(#6,.T.);
                #8=IFCFACE((#7));
                #9=IFCCLOSEDSHELL((#8));
                #10=IFCFACETEDBREP(#9);
                #11=IFCSHAPEREPRESENTATION($,'Body','Brep',(#10));
                #12=IFCREPRESENTATIONMAP(#2,#11);
                #13=IFCCARTESIANPOINT((5.,5.,0.));
                #14=IFCCARTESIANTRANSFORMATIONOPERATOR3D($,$,#13,2.,$);
                #15=IFCMAPPEDITEM(#12,#14);
                #16=IFCSHAPEREPRESENTATION($,'Body','MappedRepresentation',(#15));
                #17=IFCPRODUCTDEFINITIONSHAPE($,$,(#16));
                #18=IFCFURNISHINGELEMENT('table',$,$,$,$,#3,#17,$);
                """);

        List<ProductShape> shapes = reader.read(model, new ArrayList<>());

        assertThat(shapes).singleElement().satisfies(shape -> {
            assertClose(shape.bounds().min(), 5.0, 5.0, 0.0);
            assertClose(shape.bounds().max(), 7.0, 7.0, 0.0);
        });
    }

    @Test
    void read_skipsOpeningsAndEntitiesWithoutShape() {
        StepModel model = model("""
                #1=IFCCARTESIANPOINT((0.,0.,0.));
                #2=IFCAXIS2PLACEMENT3D(#1,$,$);
                #3=IFCLOCALPLACEMENT($,#2);
                #4=IFCCIRCLEPROFILEDEF(.AREA.,$,$,1.);
                #5=IFCEXTRUDEDAREASOLID(#4,$,$,1.);
                #6=IFCSHAPEREPRESENTATION($,'Body','SweptSolid',(#5));
                #7=IFCPRODUCTDEFINITIONSHAPE($,$,(#6));
                #8=IFCOPENINGELEMENT('hole',$,$,$,$,#3,#7,$);
                #9=IFCBUILDINGSTOREY('storey',$,$,$,$,#3,$,$,.ELEMENT.,0.);
                #10=IFCCOLUMN('column',$,$,$,$,#3,#7,$);
                """);

        List<ProductShape> shapes = reader.read(model, new ArrayList<>());

        assertThat(shapes).extracting(ProductShape::globalId).containsExactly("column");
    }

    @Test
    void read_unsupportedItemIsReportedAndOtherProductsKept() {
        StepModel model = model("""
                #1=IFCCARTESIANPOINT((0.,0.,0.));
                #2=IFCAXIS2PLACEMENT3D(#1,$,$);
                #3=IFCLOCALPLACEMENT($,#2);
                #4=IFCBLOCK(#2,1.,1.,1.);
                #5=IFCCSGSOLID(#4);
                #6=IFCSHAPEREPRESENTATION($,'Body','CSG',(#5));
                #7=IFCPRODUCTDEFINITIONSHAPE($,$,(#6));
                #8=IFCSLAB('slab',$,$,$,$,#3,#7,$,$);
                #9=IFCCIRCLEPROFILEDEF(.AREA.,$,$,1.);
                #10=IFCEXTRUDEDAREASOLID(#9,$,$,1.);
                #11=IFCSHAPEREPRESENTATION($,'Body','SweptSolid',(#10));
                #12=IFCPRODUCTDEFINITIONSHAPE($,$,(#11));
                #13=IFCCOLUMN('column',$,$,$,$,#3,#12,$);
                #14=IFCBEAM('beam',$,$,$,$,#3,#15,$);
                #15=IFCPRODUCTDEFINITIONSHAPE($,$,(#99));
                """);
        List<String> warnings = new ArrayList<>();

        List<ProductShape> shapes = reader.read(model, warnings);

        assertThat(shapes).extracting(ProductShape::globalId).containsExactly("column");
        assertThat(warnings).hasSize(2);
        assertThat(warnings.get(0)).contains("#8", "slab", "IFCCSGSOLID");
        assertThat(warnings.get(1)).contains("#14", "#99");
    }

    @Test
    void read_cyclicPlacementIsReported() {
        StepModel model = model("""
                #1=IFCCARTESIANPOINT((0.,0.,0.));
                #2=IFCAXIS2PLACEMENT3D(#1,$,$);
                #3=IFCLOCALPLACEMENT(#4,#2);
                #4=IFCLOCALPLACEMENT(#3,#2);
                #5=IFCCIRCLEPROFILEDEF(.AREA.,$,$,1.);
                #6=IFCEXTRUDEDAREASOLID(#5,$,$,1.);
                #7=IFCSHAPEREPRESENTATION($,'Body','SweptSolid',(#6));
                #8=IFCPRODUCTDEFINITIONSHAPE($,$,(#7));
                #9=IFCCOLUMN('column',$,$,$,$,#3,#8,$);
                """);
        List<String> warnings = new ArrayList<>();

        assertThat(reader.read(model, warnings)).isEmpty();
        assertThat(warnings).singleElement().asString().contains("循环引用");
    }

    private static StepModel model(String data) {
        return StepModel.parse("ISO-10303-21;\nHEADER;\nFILE_SCHEMA(('IFC2X3'));\nENDSEC;\nDATA;\n"
                + data + "ENDSEC;\nEND-ISO-10303-21;\n");
    }

    private static void assertClose(Vector3 actual, double x, double y, double z) {
        assertThat(actual.x()).isCloseTo(x, within(1e-9));
        assertThat(actual.y()).isCloseTo(y, within(1e-9));
        assertThat(actual.z()).isCloseTo(z, within(1e-9));
    }
}
