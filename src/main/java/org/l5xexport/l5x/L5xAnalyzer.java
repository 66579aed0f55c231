package org.l5xexport.l5x;

import org.l5xexport.l5x.dto.ControllerInfo;
import org.l5xexport.l5x.dto.DataTypeDef;
import org.l5xexport.l5x.dto.DataTypeMember;
import org.l5xexport.l5x.dto.InstructionDef;
import org.l5xexport.l5x.dto.InstructionParameter;
import org.l5xexport.l5x.dto.IoModule;
import org.l5xexport.l5x.dto.ModulePort;
import org.l5xexport.l5x.dto.Program;
import org.l5xexport.l5x.dto.Routine;
import org.l5xexport.l5x.dto.Tag;
import org.l5xexport.l5x.dto.TaskDef;
import org.w3c.dom.Element;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * L5X 实体抽取器：对已加载文档做只读投影。
 * <p>
 * 每个 {@code getXxx} 方法各自独立地查询文档，返回结果的顺序与文档顺序一致；
 * 程序与 AOI 的例程会交给 {@link RoutineLogicDecoder} 解码。
 * 所有属性读取都有明确缺省值，缺失的可选结构不会抛异常。
 */
public final class L5xAnalyzer {

    private final L5xDocument document;
    private final RoutineLogicDecoder decoder;

    public L5xAnalyzer(L5xDocument document) {
        this.document = Objects.requireNonNull(document, "document");
        this.decoder = new RoutineLogicDecoder(document);
    }

    public static L5xAnalyzer open(Path l5xFile) {
        return new L5xAnalyzer(L5xDocument.load(l5xFile));
    }

    public ControllerInfo getControllerInfo() {
        Element controller = document.find("Controller");
        if (controller == null) {
            return ControllerInfo.empty();
        }
        // 属性保持源文件中的书写顺序
        Map<String, String> fields = new LinkedHashMap<>(document.attributesInSourceOrder("Controller"));
        fields.put("Description", document.description(controller));
        return new ControllerInfo(fields);
    }

    public List<Tag> getGlobalTags() {
        return readTags(document.findAll("Controller/Tags/Tag"));
    }

    public List<DataTypeDef> getDataTypes() {
        List<DataTypeDef> result = new ArrayList<>();
        for (Element dataType : document.findAll("Controller/DataTypes/DataType")) {
            List<DataTypeMember> members = new ArrayList<>();
            for (Element member : document.findAll("Members/Member", dataType)) {
                members.add(new DataTypeMember(
                        L5xDocument.attribute(member, "Name", ""),
                        L5xDocument.attribute(member, "DataType", ""),
                        L5xDocument.attribute(member, "Dimension", ""),
                        L5xDocument.attribute(member, "Radix", ""),
                        L5xDocument.booleanAttribute(member, "Hidden", false),
                        document.description(member)
                ));
            }
            result.add(new DataTypeDef(
                    L5xDocument.attribute(dataType, "Name", ""),
                    L5xDocument.attribute(dataType, "Family", ""),
                    L5xDocument.attribute(dataType, "Class", ""),
                    document.description(dataType),
                    List.copyOf(members)
            ));
        }
        return List.copyOf(result);
    }

    public List<InstructionDef> getInstructionDefinitions() {
        List<InstructionDef> result = new ArrayList<>();
        for (Element aoi : document.findAll("Controller/AddOnInstructionDefinitions/AddOnInstructionDefinition")) {
            List<InstructionParameter> parameters = new ArrayList<>();
            for (Element parameter : document.findAll("Parameters/Parameter", aoi)) {
                parameters.add(new InstructionParameter(
                        L5xDocument.attribute(parameter, "Name", ""),
                        L5xDocument.attribute(parameter, "DataType", ""),
                        L5xDocument.attribute(parameter, "Usage", ""),
                        L5xDocument.booleanAttribute(parameter, "Required", false),
                        L5xDocument.booleanAttribute(parameter, "Visible", true),
                        document.description(parameter)
                ));
            }
            result.add(new InstructionDef(
                    L5xDocument.attribute(aoi, "Name", ""),
                    L5xDocument.attribute(aoi, "Revision", ""),
                    L5xDocument.attribute(aoi, "Vendor", ""),
                    document.description(aoi),
                    List.copyOf(parameters),
                    readTags(document.findAll("LocalTags/LocalTag", aoi)),
                    readRoutines(aoi)
            ));
        }
        return List.copyOf(result);
    }

    public List<IoModule> getModules() {
        List<IoModule> result = new ArrayList<>();
        for (Element module : document.findAll("Controller/Modules/Module")) {
            List<ModulePort> ports = new ArrayList<>();
            for (Element port : document.findAll("Ports/Port", module)) {
                ports.add(new ModulePort(
                        L5xDocument.attribute(port, "Id", ""),
                        L5xDocument.attribute(port, "Address", ""),
                        L5xDocument.attribute(port, "Type", ""),
                        L5xDocument.booleanAttribute(port, "Upstream", false)
                ));
            }
            result.add(new IoModule(
                    L5xDocument.attribute(module, "Name", ""),
                    L5xDocument.attribute(module, "CatalogNumber", ""),
                    L5xDocument.attribute(module, "ParentModule", ""),
                    L5xDocument.attribute(module, "ParentModPortId", ""),
                    document.description(module),
                    List.copyOf(ports)
            ));
        }
        return List.copyOf(result);
    }

    public List<TaskDef> getTasks() {
        List<TaskDef> result = new ArrayList<>();
        for (Element task : document.findAll("Controller/Tasks/Task")) {
            List<String> scheduled = new ArrayList<>();
            for (Element program : document.findAll("ScheduledPrograms/ScheduledProgram", task)) {
                String name = L5xDocument.attribute(program, "Name", "");
                if (!name.isEmpty()) {
                    scheduled.add(name);
                }
            }
            result.add(new TaskDef(
                    L5xDocument.attribute(task, "Name", ""),
                    L5xDocument.attribute(task, "Type", ""),
                    L5xDocument.attribute(task, "Rate", ""),
                    L5xDocument.attribute(task, "Priority", ""),
                    L5xDocument.attribute(task, "Watchdog", ""),
                    document.description(task),
                    List.copyOf(scheduled)
            ));
        }
        return List.copyOf(result);
    }

    public List<Program> getPrograms() {
        List<Program> result = new ArrayList<>();
        for (Element program : document.findAll("Controller/Programs/Program")) {
            result.add(new Program(
                    L5xDocument.attribute(program, "Name", ""),
                    document.description(program),
                    L5xDocument.attribute(program, "MainRoutineName", ""),
                    L5xDocument.attribute(program, "FaultRoutineName", ""),
                    L5xDocument.booleanAttribute(program, "Disabled", false),
                    readTags(document.findAll("Tags/Tag", program)),
                    readRoutines(program)
            ));
        }
        return List.copyOf(result);
    }

    private List<Tag> readTags(List<Element> tags) {
        List<Tag> result = new ArrayList<>(tags.size());
        for (Element tag : tags) {
            result.add(new Tag(
                    L5xDocument.attribute(tag, "Name", ""),
                    L5xDocument.attribute(tag, "DataType", ""),
                    L5xDocument.attribute(tag, "Usage", "Local"),
                    L5xDocument.attribute(tag, "AliasFor", ""),
                    L5xDocument.attribute(tag, "Radix", ""),
                    document.description(tag)
            ));
        }
        return List.copyOf(result);
    }

    private List<Routine> readRoutines(Element owner) {
        List<Routine> result = new ArrayList<>();
        for (Element routine : document.findAll("Routines/Routine", owner)) {
            String type = L5xDocument.attribute(routine, "Type", "");
            result.add(new Routine(
                    L5xDocument.attribute(routine, "Name", ""),
                    type,
                    document.description(routine),
                    List.copyOf(decoder.decode(routine, type))
            ));
        }
        return List.copyOf(result);
    }
}
