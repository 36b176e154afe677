package aster.contractgen.support;

/**
 * 合约生成过程中的内部不变量被破坏。
 *
 * <p>输入已由上游校验，出现此异常说明校验器或生成器本身存在缺陷；生成立即中止，不产出部分结果。</p>
 */
public class GenerationException extends RuntimeException {
  public GenerationException(String message) {
    super(message);
  }

  public GenerationException(String message, Throwable cause) {
    super(message, cause);
  }
}
