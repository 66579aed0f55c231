package org.l5xexport.l5x;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * 测试用的 L5X 样例文档。
 */
public final class L5xFixtures {

    public static final String NAMESPACE = "urn:example:l5x";

    public static final String SAMPLE = """
            <?xml version="1.0" encoding="UTF-8" standalone="yes"?>
            <RSLogix5000Content SchemaRevision="1.0" SoftwareRevision="33.00" TargetName="Line1" TargetType="Controller">
            <Controller Use="Target" Name="Line1" ProcessorType="1756-L83E" MajorRev="33" MinorRev="11">
            <Description><![CDATA[ Packaging
            line controller ]]></Description>
            <DataTypes>
            <DataType Name="Motor" Family="NoFamily" Class="User">
            <Description><![CDATA[Motor UDT]]></Description>
            <Members>
            <Member Name="ZZZZZZZZZZMotor0" DataType="SINT" Dimension="0" Radix="Decimal" Hidden="true"/>
            <Member Name="Running" DataType="BIT" Dimension="0" Radix="Decimal" Hidden="false">
            <Description><![CDATA[Motor running feedback]]></Description>
            </Member>
            </Members>
            </DataType>
            <DataType Name="STRING20" Family="StringFamily" Class="Predefined"/>
            </DataTypes>
            <Modules>
            <Module Name="Local" CatalogNumber="1756-L83E">
            <Ports>
            <Port Id="1" Address="0" Type="ICP" Upstream="false"/>
            </Ports>
            </Module>
            <Module Name="IO_Rack" CatalogNumber="1756-EN2T" ParentModule="Local" ParentModPortId="1">
            <Description>Remote rack</Description>
            <Ports>
            <Port Id="1" Address="2" Type="ICP" Upstream="true"/>
            <Port Id="2" Type="Ethernet"/>
            </Ports>
            </Module>
            </Modules>
            <AddOnInstructionDefinitions>
            <AddOnInstructionDefinition Name="Valve" Revision="1.2" Vendor="Acme">
            <Description><![CDATA[Valve control]]></Description>
            <Parameters>
            <Parameter Name="EnableIn" DataType="BOOL" Usage="Input" Visible="false"/>
            <Parameter Name="Open" DataType="BOOL" Usage="Input" Required="true">
            <Description><![CDATA[Open command]]></Description>
            </Parameter>
            </Parameters>
            <LocalTags>
            <LocalTag Name="Timer" DataType="TIMER" Radix="NullType"/>
            </LocalTags>
            <Routines>
            <Routine Name="Logic" Type="ST">
            <STContent>
            <Line Number="0"><![CDATA[IF Open THEN]]></Line>
            <Line Number="1"><![CDATA[    Out := 1;]]></Line>
            <Line Number="2"><![CDATA[END_IF;]]></Line>
            </STContent>
            </Routine>
            </Routines>
            </AddOnInstructionDefinition>
            </AddOnInstructionDefinitions>
            <Tags>
            <Tag Name="StartPB" TagType="Base" DataType="BOOL" Radix="Decimal">
            <Description><![CDATA[Start push button]]></Description>
            </Tag>
            <Tag Name="Conveyor_Run" TagType="Alias" AliasFor="Local:1:O.Data.0" Usage="Public"/>
            </Tags>
            <Programs>
            <Program Name="MainProgram" MainRoutineName="MainRoutine" FaultRoutineName="Fault" Disabled="false">
            <Description>Main line logic</Description>
            <Tags>
            <Tag Name="Step" DataType="DINT" Radix="Decimal"/>
            </Tags>
            <Routines>
            <Routine Name="MainRoutine" Type="RLL">
            <Description>Start/stop</Description>
            <RLLContent>
            <Rung Number="0" Type="N">
            <Comment><![CDATA[main desc]]></Comment>
            <Comment Operand="O:1"><![CDATA[motor]]></Comment>
            <Text><![CDATA[XIC(Start)OTE(Run)]]></Text>
            </Rung>
            <Rung Number="1" Type="D">
            <Text><![CDATA[  NOP();]]></Text>
            </Rung>
            </RLLContent>
            </Routine>
            <Routine Name="Calc" Type="ST">
            <STContent OnlineEditType="Previous">
            <Line Number="0"><![CDATA[x := 1;]]></Line>
            </STContent>
            <STContent>
            <Line Number="0"><![CDATA[IF a THEN]]></Line>
            <Line Number="1"><![CDATA[    x := 2;]]></Line>
            <Line Number="2"><![CDATA[END_IF;]]></Line>
            </STContent>
            </Routine>
            <Routine Name="Blend" Type="FBD">
            <FBDContent SheetSize="Letter">
            <Sheet Number="1">
            <IRef ID="0" Operand="In1"/>
            <Block Type="ADD" ID="1"/>
            <Block Type="MUL" ID="2"/>
            <Wire FromID="0" ToID="1"/>
            </Sheet>
            <Sheet Number="2">
            <Block Type="PIDE" ID="3"/>
            <Wire FromID="1" ToID="3"/>
            <Wire FromID="2" ToID="3"/>
            </Sheet>
            </FBDContent>
            </Routine>
            <Routine Name="Sequence" Type="SFC">
            <SFCContent>
            <Step ID="0" Name="Idle"/>
            <Step ID="1"/>
            <Transition ID="2"/>
            <ActionStructure/>
            </SFCContent>
            </Routine>
            <Routine Name="Legacy" Type="XYZ"/>
            </Routines>
            </Program>
            <Program Name="Spare" Disabled="true"/>
            </Programs>
            <Tasks>
            <Task Name="MainTask" Type="CONTINUOUS" Priority="10" Watchdog="500">
            <ScheduledPrograms>
            <ScheduledProgram Name="MainProgram"/>
            <ScheduledProgram Name="Ghost"/>
            <ScheduledProgram/>
            </ScheduledPrograms>
            </Task>
            <Task Name="Fast" Type="PERIODIC" Rate="10" Priority="5" Watchdog="100">
            <Description>10ms loop</Description>
            </Task>
            </Tasks>
            </Controller>
            </RSLogix5000Content>
            """;

    private L5xFixtures() {
    }

    /**
     * 把同一份文档改为在根元素上声明默认命名空间。
     */
    public static String withNamespace(String xml) {
        return xml.replace("<RSLogix5000Content ", "<RSLogix5000Content xmlns=\"" + NAMESPACE + "\" ");
    }

    public static Path write(Path dir, String fileName, String xml) throws IOException {
        Path file = dir.resolve(fileName);
        Files.writeString(file, xml, StandardCharsets.UTF_8);
        return file;
    }

    /**
     * 用给定的 Controller 元素本身拼出一个最小文档。
     */
    public static String controllerElement(String controller) {
        return "<?xml version=\"1.0\" encoding=\"UTF-8\"?>\n"
                + "<RSLogix5000Content SchemaRevision=\"1.0\">" + controller + "</RSLogix5000Content>\n";
    }

    /**
     * 用给定的 Controller 内容拼出一个最小文档。
     */
    public static String controller(String body) {
        return """
                <?xml version="1.0" encoding="UTF-8"?>
                <RSLogix5000Content SchemaRevision="1.0">
                <Controller Name="Test">
                """ + body + """
                </Controller>
                </RSLogix5000Content>
                """;
    }
}
