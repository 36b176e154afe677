package aster.contractgen;

import aster.contractgen.core.SpecModel.*;
import org.junit.jupiter.api.DynamicTest;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.TestFactory;
import org.junit.jupiter.api.io.TempDir;

import java.net.URISyntaxException;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.stream.Stream;

import static org.junit.jupiter.api.Assertions.*;

/**
 * SpecificationLoader 测试
 * <p>
 * 验证 JSON 规约树的多态反序列化，以及文件或结构错误时的诊断。
 */
class SpecificationLoaderTest {

    private final SpecificationLoader loader = new SpecificationLoader();

    static Path resource(String name) {
        try {
            return Paths.get(SpecificationLoaderTest.class.getClassLoader().getResource("specs/" + name).toURI());
        } catch (URISyntaxException e) {
            throw new IllegalStateException(e);
        }
    }

    // ============================================================
    // 正常加载
    // ============================================================

    @Test
    void testLoadMatchesProgrammaticModel() throws Exception {
        Specification loaded = loader.load(resource("auction.json"));
        assertEquals(ContractGeneratorTest.auction(), loaded, "JSON 与代码构造的规约树应完全相等");
    }

    @Test
    void testLoadedSpecGeneratesSameContract() throws Exception {
        ContractGenerator generator = new ContractGenerator("0.5.7", "    ");
        assertEquals(generator.generate(ContractGeneratorTest.auction()),
                generator.generate(loader.load(resource("auction.json"))));
    }

    @Test
    void testPolymorphicNodes() throws Exception {
        Specification spec = loader.load(resource("multisig.json"));
        StateMachine machine = spec.stateMachine();

        assertEquals(new MappingT(new IdentityT(), new IntT()), machine.fields().get(1).type());

        Transition init = machine.transitions().get(0);
        assertTrue(init.isInitial());
        assertTrue(init.parameters().isEmpty(), "缺省参数列表应归一化为空列表");
        assertTrue(init.body().isEmpty());
        assertNull(init.guard());
        assertFalse(init.auto());

        Transition execute = machine.transitions().get(1);
        AuthCombination auth = assertInstanceOf(AuthCombination.class, execute.authorized());
        assertEquals(new IdentityLiteral("admin"), auth.left());
        assertEquals(AuthOperator.AND, auth.operator());
        assertEquals(new AuthAll("owners"), auth.right());

        Send send = assertInstanceOf(Send.class, execute.body().get(0));
        assertEquals(new VarRef("escrow"), send.source());
        assertEquals(new MappingRef(new VarRef("limits"), new VarRef("recipient")), send.amount());
        assertEquals(new SequenceSize(new VarRef("owners")),
                ((LogicalOperation) execute.guard()).left());
    }

    @Test
    void testGenerateFromLoadedMultisig() throws Exception {
        String text = new ContractGenerator("0.5.7", "    ").generate(loader.load(resource("multisig.json")));
        assertTrue(text.contains("mapping(address => int) public limits;"));
        assertTrue(text.contains("address payable public recipient;"));
        assertTrue(text.contains("bool private __execute_adminApproved;"));
        assertTrue(text.contains("mapping(address => bool) private __execute_ownersApproved;"));
        assertTrue(text.contains("require(owners.length > 0);"));
        assertTrue(text.contains("""
                        int __temporary = limits[recipient];
                        escrow = escrow - __temporary;
                        recipient.transfer(uint(__temporary));
                """));
    }

    @TestFactory
    Stream<DynamicTest> testValidFixturesGenerateDeterministically() {
        ContractGenerator generator = new ContractGenerator();
        return Stream.of("auction.json", "multisig.json").map(name -> DynamicTest.dynamicTest(name, () -> {
            Specification spec = loader.load(resource(name));
            String first = generator.generate(spec);
            assertTrue(first.contains("contract " + spec.name() + " {"));
            assertEquals(first, generator.generate(loader.load(resource(name))));
        }));
    }

    @Test
    void testUnknownPropertiesIgnored() throws Exception {
        // auction.json 顶层带有 generatedBy 元数据
        assertEquals("SimpleAuction", loader.load(resource("auction.json")).name());
    }

    // ============================================================
    // 错误处理
    // ============================================================

    @Test
    void testMissingFile(@TempDir Path dir) {
        Path missing = dir.resolve("nope.json");
        var e = assertThrows(SpecificationLoader.LoadException.class, () -> loader.load(missing));
        assertTrue(e.getMessage().contains("无法读取规约文件"));
        assertTrue(e.getMessage().contains("nope.json"));
    }

    @Test
    void testMalformedJson() {
        var e = assertThrows(SpecificationLoader.LoadException.class, () -> loader.parse("{ \"name\": "));
        assertTrue(e.getMessage().startsWith("规约 JSON 解析失败"));
        assertNotNull(e.getCause());
    }

    @Test
    void testMissingRequiredField() {
        var e = assertThrows(SpecificationLoader.LoadException.class,
                () -> loader.load(resource("missing-name.json")));
        assertTrue(e.getMessage().startsWith("规约 JSON 解析失败"));
    }

    @Test
    void testUnknownKind() {
        var e = assertThrows(SpecificationLoader.LoadException.class,
                () -> loader.load(resource("unknown-kind.json")));
        assertTrue(e.getMessage().contains("Float"), "诊断信息应指出无法识别的类型名");
    }

    @Test
    void testNullDocument() {
        var e = assertThrows(SpecificationLoader.LoadException.class, () -> loader.parse("null"));
        assertEquals("规约 JSON 为空", e.getMessage());
    }
}
