package aster.contractgen;

import aster.contractgen.core.SpecModel.Specification;
import aster.contractgen.support.ContractGenConfig;
import aster.contractgen.support.GenerationException;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.logging.Level;
import java.util.logging.Logger;

public final class Runner {
  private static final Logger LOGGER = Logger.getLogger(Runner.class.getName());

  private Runner() {}

  public static void main(String[] args) {
    System.exit(run(args));
  }

  /**
   * 解析参数并执行生成，返回进程退出码。
   */
  static int run(String[] args) {
    if (args.length == 0) {
      printUsage();
      return 2;
    }
    List<String> argList = new ArrayList<>(Arrays.asList(args));
    Path input = Paths.get(argList.remove(0));
    Path output = null;

    // Support --out=<file> or --out <file>
    for (int i = 0; i < argList.size(); i++) {
      String a = argList.get(i);
      if (a.startsWith("--out=")) {
        output = Paths.get(a.substring("--out=".length()));
      } else if ("--out".equals(a) && i + 1 < argList.size()) {
        output = Paths.get(argList.get(++i));
      } else {
        System.err.println("Unknown option: " + a);
        printUsage();
        return 2;
      }
    }

    if (ContractGenConfig.DEBUG) {
      System.err.println("DEBUG: input=" + input.toAbsolutePath());
      System.err.println("DEBUG: output=" + (output == null ? "<stdout>" : output.toAbsolutePath()));
    }

    try {
      Specification spec = new SpecificationLoader().load(input);
      String contract = new ContractGenerator().generate(spec);
      if (output == null) {
        System.out.print(contract);
      } else {
        Files.writeString(output, contract);
      }
      if (ContractGenConfig.DEBUG) {
        System.err.println("DEBUG: generated " + contract.length() + " chars for " + spec.name());
      }
      return 0;
    } catch (SpecificationLoader.LoadException e) {
      LOGGER.log(Level.SEVERE, "加载规约失败: " + input, e);
      System.err.println("Error: " + e.getMessage());
      return 1;
    } catch (GenerationException e) {
      LOGGER.log(Level.SEVERE, "合约生成失败（内部错误）: " + input, e);
      System.err.println("Internal error: " + e.getMessage());
      return 3;
    } catch (IOException e) {
      LOGGER.log(Level.SEVERE, "写入输出失败: " + output, e);
      System.err.println("Error: " + e.getMessage());
      return 1;
    }
  }

  private static void printUsage() {
    System.err.println("Usage: Runner <spec.json> [--out=<file>]");
    System.err.println("  --out=<file>    Write the contract to <file> instead of stdout");
    System.err.println("");
    System.err.println("Environment:");
    System.err.println("  CONTRACTGEN_SOLIDITY_VERSION  pragma version (default: " + ContractGenConfig.SOLIDITY_VERSION + ")");
    System.err.println("  CONTRACTGEN_DEBUG             print diagnostics to stderr");
  }
}
