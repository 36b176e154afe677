package aster.contractgen.support;

/**
 * 合约生成器配置
 *
 * 集中管理所有环境变量配置，在类加载时读取一次。
 */
public final class ContractGenConfig {
  private ContractGenConfig() {}

  /**
   * 调试模式开关
   * 环境变量：CONTRACTGEN_DEBUG
   * 启用时 Runner 在 stderr 打印输入路径与生成摘要
   */
  public static final boolean DEBUG = System.getenv("CONTRACTGEN_DEBUG") != null;

  /**
   * 目标 Solidity 最低版本
   * 环境变量：CONTRACTGEN_SOLIDITY_VERSION
   * 如果未指定，默认为 "0.5.7"
   */
  public static final String SOLIDITY_VERSION = getEnvOrDefault("CONTRACTGEN_SOLIDITY_VERSION", "0.5.7");

  /**
   * 辅助方法：读取环境变量或返回默认值
   */
  private static String getEnvOrDefault(String key, String defaultValue) {
    String value = System.getenv(key);
    return value != null && !value.isBlank() ? value : defaultValue;
  }
}
