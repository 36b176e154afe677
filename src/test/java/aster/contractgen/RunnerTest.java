package aster.contractgen;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Runner 命令行测试：退出码与输出文件。
 */
class RunnerTest {

    @Test
    void testNoArgumentsPrintsUsage() {
        assertEquals(2, Runner.run(new String[0]));
    }

    @Test
    void testUnknownOption() {
        String input = SpecificationLoaderTest.resource("auction.json").toString();
        assertEquals(2, Runner.run(new String[]{input, "--verbose"}));
    }

    @Test
    void testWritesContractToFile(@TempDir Path dir) throws Exception {
        Path out = dir.resolve("SimpleAuction.sol");
        String input = SpecificationLoaderTest.resource("auction.json").toString();

        assertEquals(0, Runner.run(new String[]{input, "--out=" + out}));

        String text = Files.readString(out);
        assertTrue(text.startsWith("pragma solidity >="));
        assertTrue(text.contains("contract SimpleAuction {"));
        assertTrue(text.endsWith("}\n"));
    }

    @Test
    void testSeparateOutArgument(@TempDir Path dir) throws Exception {
        Path out = dir.resolve("Multisig.sol");
        String input = SpecificationLoaderTest.resource("multisig.json").toString();

        assertEquals(0, Runner.run(new String[]{input, "--out", out.toString()}));
        assertTrue(Files.readString(out).contains("contract Multisig {"));
    }

    @Test
    void testMissingInputFile(@TempDir Path dir) {
        assertEquals(1, Runner.run(new String[]{dir.resolve("absent.json").toString()}));
    }

    @Test
    void testInvariantViolationIsInternalError(@TempDir Path dir) throws Exception {
        Path input = dir.resolve("bad.json");
        Files.writeString(input, """
                {
                  "name": "Bad",
                  "stateMachine": {
                    "states": ["A"],
                    "transitions": [
                      { "name": "one", "destination": "A" },
                      { "name": "two", "destination": "A" }
                    ]
                  }
                }
                """);
        assertEquals(3, Runner.run(new String[]{input.toString(), "--out=" + dir.resolve("bad.sol")}));
        assertFalse(Files.exists(dir.resolve("bad.sol")), "生成失败时不写出文件");
    }
}
