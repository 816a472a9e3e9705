package org.example.gis2bim.conversion.io;

import org.example.gis2bim.conversion.attribute.AttributeValue;
import org.example.gis2bim.conversion.attribute.PropertySet;
import org.example.gis2bim.conversion.geometry.BoundaryMesh;
import org.example.gis2bim.conversion.geometry.Box;
import org.example.gis2bim.conversion.geometry.ExtrudedSolid;
import org.example.gis2bim.conversion.geometry.SolidGeometry;
import org.example.gis2bim.conversion.geometry.SweptPipe;
import org.example.gis2bim.conversion.geometry.Vector3;
import org.example.gis2bim.conversion.model.HierarchyNode;
import org.example.gis2bim.conversion.model.IfcGuid;
import org.example.gis2bim.conversion.model.ModelElement;
import org.example.gis2bim.conversion.model.ModelGraph;
import org.example.gis2bim.conversion.model.ProjectInfo;
import org.example.gis2bim.conversion.style.ResolvedStyle;
import org.example.gis2bim.conversion.style.RgbColor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.example.gis2bim.conversion.io.StepText.NULL;
import static org.example.gis2bim.conversion.io.StepText.real;
import static org.example.gis2bim.conversion.io.StepText.reals;
import static org.example.gis2bim.conversion.io.StepText.ref;
import static org.example.gis2bim.conversion.io.StepText.refs;
import static org.example.gis2bim.conversion.io.StepText.string;

/**
 * 把 {@link ModelGraph} 写成 IFC2X3 STEP 物理文件。
 * <p>
 * 结构：IfcProject → IfcSite → IfcBuilding → 每个图层一个 IfcBuildingStorey（IfcRelAggregates），
 * 构件为 IfcBuildingElementProxy（IfcRelContainedInSpatialStructure），每个构件一个属性集和一个表面样式。
 * <p>
 * 关系实体与属性集的 GlobalId 由所属对象的 GlobalId 派生，同一模型重复写出得到相同的 DATA 段。
 */
public class IfcStepWriter {

    private static final Logger log = LoggerFactory.getLogger(IfcStepWriter.class);

    public static final String SCHEMA = "IFC2X3";

    private final Representation representation;
    private final Clock clock;

    public IfcStepWriter(Representation representation, Clock clock) {
        this.representation = representation;
        this.clock = clock;
    }

    public IfcStepWriter(Representation representation) {
        this(representation, Clock.systemDefaultZone());
    }

    public Representation representation() {
        return representation;
    }

    public void write(ModelGraph graph, Path output) {
        String text = toStepText(graph, output.getFileName().toString());
        try {
            Path parent = output.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            try (Writer writer = Files.newBufferedWriter(output, StandardCharsets.US_ASCII)) {
                writer.write(text);
            }
        } catch (IOException e) {
            throw new UncheckedIOException("写出 IFC 文件失败：" + output, e);
        }
        log.info("IFC 文件已写出：path={}, elements={}, representation={}, bytes={}",
                output, graph.elementCount(), representation, text.length());
    }

    public String toStepText(ModelGraph graph, String fileName) {
        LocalDateTime now = LocalDateTime.now(clock).truncatedTo(ChronoUnit.SECONDS);
        ProjectInfo info = graph.projectInfo();
        StringBuilder out = new StringBuilder(64 * 1024);
        out.append("ISO-10303-21;\n");
        out.append("HEADER;\n");
        out.append("FILE_DESCRIPTION(('ViewDefinition [CoordinationView]'),'2;1');\n");
        out.append("FILE_NAME(")
                .append(string(fileName)).append(',')
                .append(string(now.format(DateTimeFormatter.ISO_LOCAL_DATE_TIME))).append(',')
                .append('(').append(string(nullToEmpty(ownerName(info)))).append("),")
                .append('(').append(string(nullToEmpty(info.organization()))).append("),")
                .append(string(info.applicationName() + " " + info.applicationVersion())).append(',')
                .append(string(info.applicationName())).append(',')
                .append("'');\n");
        out.append("FILE_SCHEMA((").append(string(SCHEMA)).append("));\n");
        out.append("ENDSEC;\n");
        out.append("DATA;\n");
        new DataSection(out, graph, now).write();
        out.append("ENDSEC;\n");
        out.append("END-ISO-10303-21;\n");
        return out.toString();
    }

    private static String ownerName(ProjectInfo info) {
        if (info.ownerGivenName() == null && info.ownerFamilyName() == null) {
            return null;
        }
        return (nullToEmpty(info.ownerGivenName()) + " " + nullToEmpty(info.ownerFamilyName())).trim();
    }

    private static String nullToEmpty(String value) {
        return value == null ? "" : value;
    }

    /**
     * 一次写出的 DATA 段状态：实体编号计数器与共享实体。
     */
    private final class DataSection {

        private final StringBuilder out;
        private final ModelGraph graph;
        private final LocalDateTime now;
        private int nextId = 1;

        private int ownerHistory;
        private int context;
        private int origin3d;
        private int axisZ;
        private int axisX;
        private int origin2d;
        private int worldPlacement;
        private final Map<String, Integer> styleAssignments = new HashMap<>();

        DataSection(StringBuilder out, ModelGraph graph, LocalDateTime now) {
            this.out = out;
            this.graph = graph;
            this.now = now;
        }

        void write() {
            ProjectInfo info = graph.projectInfo();
            writeSharedEntities(info);

            HierarchyNode projectNode = graph.project();
            int units = writeUnits();
            int project = add("IFCPROJECT", string(projectNode.globalId()), ref(ownerHistory), string(projectNode.name()),
                    string(info.description()), NULL, NULL, NULL, refs(List.of(context)), ref(units));

            HierarchyNode siteNode = graph.site();
            int sitePlacement = add("IFCLOCALPLACEMENT", NULL, ref(worldPlacement));
            int site = add("IFCSITE", string(siteNode.globalId()), ref(ownerHistory), string(siteNode.name()), NULL, NULL,
                    ref(sitePlacement), NULL, NULL, ".ELEMENT.", NULL, NULL, NULL, NULL, NULL);
            aggregate(projectNode, project, List.of(site));

            HierarchyNode buildingNode = graph.building();
            int buildingPlacement = add("IFCLOCALPLACEMENT", ref(sitePlacement), ref(worldPlacement));
            int building = add("IFCBUILDING", string(buildingNode.globalId()), ref(ownerHistory), string(buildingNode.name()),
                    NULL, NULL, ref(buildingPlacement), NULL, NULL, ".ELEMENT.", NULL, NULL, NULL);
            aggregate(siteNode, site, List.of(building));

            List<Integer> storeys = new ArrayList<>();
            for (HierarchyNode layer : graph.layers()) {
                int storeyPlacement = add("IFCLOCALPLACEMENT", ref(buildingPlacement), ref(worldPlacement));
                int storey = add("IFCBUILDINGSTOREY", string(layer.globalId()), ref(ownerHistory), string(layer.name()),
                        NULL, NULL, ref(storeyPlacement), NULL, NULL, ".ELEMENT.", real(0.0));
                storeys.add(storey);
                writeLayerElements(layer, storey, storeyPlacement);
            }
            if (!storeys.isEmpty()) {
                aggregate(buildingNode, building, storeys);
            }
        }

        private void writeSharedEntities(ProjectInfo info) {
            int person = add("IFCPERSON", NULL, string(info.ownerFamilyName()), string(info.ownerGivenName()),
                    NULL, NULL, NULL, NULL, NULL);
            int organization = add("IFCORGANIZATION", NULL, string(orDefault(info.organization(), info.applicationName())),
                    NULL, NULL, NULL);
            int personAndOrg = add("IFCPERSONANDORGANIZATION", ref(person), ref(organization), NULL);
            int application = add("IFCAPPLICATION", ref(organization), string(info.applicationVersion()),
                    string(info.applicationName()), string(info.applicationName()));
            long created = now.atZone(clock.getZone()).toEpochSecond();
            ownerHistory = add("IFCOWNERHISTORY", ref(personAndOrg), ref(application), NULL, ".ADDED.", NULL, NULL, NULL,
                    Long.toString(created));

            origin3d = add("IFCCARTESIANPOINT", reals(0.0, 0.0, 0.0));
            axisZ = add("IFCDIRECTION", reals(0.0, 0.0, 1.0));
            axisX = add("IFCDIRECTION", reals(1.0, 0.0, 0.0));
            origin2d = add("IFCCARTESIANPOINT", reals(0.0, 0.0));
            worldPlacement = add("IFCAXIS2PLACEMENT3D", ref(origin3d), ref(axisZ), ref(axisX));
            context = add("IFCGEOMETRICREPRESENTATIONCONTEXT", NULL, string("Model"), "3", real(1.0E-5),
                    ref(worldPlacement), NULL);
        }

        private int writeUnits() {
            int length = add("IFCSIUNIT", StepText.DERIVED, ".LENGTHUNIT.", NULL, ".METRE.");
            int area = add("IFCSIUNIT", StepText.DERIVED, ".AREAUNIT.", NULL, ".SQUARE_METRE.");
            int volume = add("IFCSIUNIT", StepText.DERIVED, ".VOLUMEUNIT.", NULL, ".CUBIC_METRE.");
            int angle = add("IFCSIUNIT", StepText.DERIVED, ".PLANEANGLEUNIT.", NULL, ".RADIAN.");
            return add("IFCUNITASSIGNMENT", refs(List.of(length, area, volume, angle)));
        }

        private void aggregate(HierarchyNode parentNode, int parent, List<Integer> children) {
            add("IFCRELAGGREGATES", string(derivedId(parentNode.globalId(), "aggregates")), ref(ownerHistory),
                    NULL, NULL, ref(parent), refs(children));
        }

        private void writeLayerElements(HierarchyNode layer, int storey, int storeyPlacement) {
            List<Integer> proxies = new ArrayList<>(layer.elements().size());
            for (ModelElement element : layer.elements()) {
                proxies.add(writeElement(element, storeyPlacement));
            }
            if (!proxies.isEmpty()) {
                add("IFCRELCONTAINEDINSPATIALSTRUCTURE", string(derivedId(layer.globalId(), "contains")), ref(ownerHistory),
                        NULL, NULL, refs(proxies), ref(storey));
            }
        }

        private int writeElement(ModelElement element, int storeyPlacement) {
            SolidGeometry geometry = element.geometry();
            Vector3 o = geometry.placement().origin();
            int location = add("IFCCARTESIANPOINT", reals(o.x(), o.y(), o.z()));
            int axis = add("IFCAXIS2PLACEMENT3D", ref(location), ref(axisZ), ref(axisX));
            int placement = add("IFCLOCALPLACEMENT", ref(storeyPlacement), ref(axis));

            int item;
            String representationType;
            if (representation == Representation.BREP) {
                item = writeBrep(geometry.toBoundaryMesh());
                representationType = "Brep";
            } else if (geometry instanceof Box box) {
                item = writeBox(box);
                representationType = "SweptSolid";
            } else if (geometry instanceof ExtrudedSolid extruded) {
                item = writeExtrusion(extruded);
                representationType = "SweptSolid";
            } else {
                item = writePipe((SweptPipe) geometry);
                representationType = "SolidModel";
            }
            writeStyledItem(item, element.style());

            int shape = add("IFCSHAPEREPRESENTATION", ref(context), string("Body"), string(representationType), refs(List.of(item)));
            int productShape = add("IFCPRODUCTDEFINITIONSHAPE", NULL, NULL, refs(List.of(shape)));
            int proxy = add("IFCBUILDINGELEMENTPROXY", string(element.globalId()), ref(ownerHistory), string(element.name()),
                    NULL, string(element.style().category()), ref(placement), ref(productShape), NULL, NULL);
            writeProperties(element, proxy);
            return proxy;
        }

        private int writeBox(Box box) {
            int position = add("IFCAXIS2PLACEMENT2D", ref(origin2d), NULL);
            int profile = add("IFCRECTANGLEPROFILEDEF", ".AREA.", NULL, ref(position), real(box.width()), real(box.depth()));
            return add("IFCEXTRUDEDAREASOLID", ref(profile), ref(worldPlacement), ref(axisZ), real(box.height()));
        }

        private int writeExtrusion(ExtrudedSolid solid) {
            int outer = polyline2d(solid.outerRing());
            int profile;
            if (solid.innerRings().isEmpty()) {
                profile = add("IFCARBITRARYCLOSEDPROFILEDEF", ".AREA.", NULL, ref(outer));
            } else {
                List<Integer> inners = new ArrayList<>(solid.innerRings().size());
                for (List<Vector3> ring : solid.innerRings()) {
                    inners.add(polyline2d(ring));
                }
                profile = add("IFCARBITRARYPROFILEDEFWITHVOIDS", ".AREA.", NULL, ref(outer), refs(inners));
            }
            return add("IFCEXTRUDEDAREASOLID", ref(profile), ref(worldPlacement), ref(axisZ), real(solid.height()));
        }

        private int polyline2d(List<Vector3> ring) {
            List<Integer> points = new ArrayList<>(ring.size() + 1);
            for (Vector3 p : ring) {
                points.add(add("IFCCARTESIANPOINT", reals(p.x(), p.y())));
            }
            points.add(points.get(0));
            return add("IFCPOLYLINE", refs(points));
        }

        private int writePipe(SweptPipe pipe) {
            List<Integer> points = new ArrayList<>(pipe.centerline().size());
            for (Vector3 p : pipe.centerline()) {
                points.add(add("IFCCARTESIANPOINT", reals(p.x(), p.y(), p.z())));
            }
            int directrix = add("IFCPOLYLINE", refs(points));
            // 折线按段参数化，每段长度为 1
            return add("IFCSWEPTDISKSOLID", ref(directrix), real(pipe.radius()), NULL, real(0.0),
                    real(pipe.segmentCount()));
        }

        private int writeBrep(BoundaryMesh mesh) {
            List<Integer> vertexIds = new ArrayList<>(mesh.vertices().size());
            for (Vector3 v : mesh.vertices()) {
                vertexIds.add(add("IFCCARTESIANPOINT", reals(v.x(), v.y(), v.z())));
            }
            List<Integer> faces = new ArrayList<>(mesh.faces().size());
            for (BoundaryMesh.MeshFace face : mesh.faces()) {
                List<Integer> bounds = new ArrayList<>(1 + face.innerLoops().size());
                int outerLoop = add("IFCPOLYLOOP", refs(loopPoints(vertexIds, face.outerLoop())));
                bounds.add(add("IFCFACEOUTERBOUND", ref(outerLoop), StepText.bool(true)));
                for (List<Integer> inner : face.innerLoops()) {
                    int innerLoop = add("IFCPOLYLOOP", refs(loopPoints(vertexIds, inner)));
                    bounds.add(add("IFCFACEBOUND", ref(innerLoop), StepText.bool(true)));
                }
                faces.add(add("IFCFACE", refs(bounds)));
            }
            int shell = add("IFCCLOSEDSHELL", refs(faces));
            return add("IFCFACETEDBREP", ref(shell));
        }

        private List<Integer> loopPoints(List<Integer> vertexIds, List<Integer> loop) {
            List<Integer> out = new ArrayList<>(loop.size());
            for (int index : loop) {
                out.add(vertexIds.get(index));
            }
            return out;
        }

        private void writeStyledItem(int item, ResolvedStyle style) {
            RgbColor color = style.color();
            String key = style.category() + "|" + color.toHex();
            Integer assignment = styleAssignments.get(key);
            if (assignment == null) {
                int colour = add("IFCCOLOURRGB", string(style.category()), real(color.red()), real(color.green()), real(color.blue()));
                int rendering = add("IFCSURFACESTYLERENDERING", ref(colour), real(color.transparency()),
                        NULL, NULL, NULL, NULL, NULL, NULL, ".NOTDEFINED.");
                int surfaceStyle = add("IFCSURFACESTYLE", string(style.category()), ".BOTH.", refs(List.of(rendering)));
                assignment = add("IFCPRESENTATIONSTYLEASSIGNMENT", refs(List.of(surfaceStyle)));
                styleAssignments.put(key, assignment);
            }
            add("IFCSTYLEDITEM", ref(item), refs(List.of(assignment)), NULL);
        }

        private void writeProperties(ModelElement element, int proxy) {
            PropertySet set = element.properties();
            if (set.isEmpty()) {
                return;
            }
            List<Integer> properties = new ArrayList<>(set.size());
            for (PropertySet.Property property : set.properties()) {
                properties.add(add("IFCPROPERTYSINGLEVALUE", string(property.name()), NULL, nominalValue(property.value()), NULL));
            }
            int propertySet = add("IFCPROPERTYSET", string(derivedId(element.globalId(), "pset")), ref(ownerHistory),
                    string(set.name()), NULL, refs(properties));
            add("IFCRELDEFINESBYPROPERTIES", string(derivedId(element.globalId(), "defines")), ref(ownerHistory),
                    NULL, NULL, refs(List.of(proxy)), ref(propertySet));
        }

        private int add(String type, String... args) {
            int id = nextId++;
            out.append('#').append(id).append('=').append(type).append('(');
            for (int i = 0; i < args.length; i++) {
                if (i > 0) {
                    out.append(',');
                }
                out.append(args[i]);
            }
            out.append(");\n");
            return id;
        }
    }

    static String nominalValue(AttributeValue value) {
        if (value instanceof AttributeValue.IntegerValue integer) {
            return "IFCINTEGER(" + integer.value() + ")";
        }
        if (value instanceof AttributeValue.NumberValue number) {
            return "IFCREAL(" + real(number.value()) + ")";
        }
        if (value instanceof AttributeValue.BooleanValue bool) {
            return "IFCBOOLEAN(" + StepText.bool(bool.value()) + ")";
        }
        return "IFCLABEL(" + string(((AttributeValue.TextValue) value).value()) + ")";
    }

    private static String derivedId(String globalId, String role) {
        return IfcGuid.fromName(globalId + "/" + role);
    }

    private static String orDefault(String value, String fallback) {
        return (value == null || value.isBlank()) ? fallback : value;
    }
}
