package aster.contractgen.codegen;

/**
 * 带缩进层级的文本输出器。
 *
 * <p>每次生成创建独立实例，缩进层级随实例传递，不存在进程级共享状态，因此同一生成器可并发处理多个规约。</p>
 */
public final class SourceWriter {
  public static final String DEFAULT_INDENT = "    ";

  private final StringBuilder out = new StringBuilder();
  private final String indentUnit;
  private int depth;
  // 同一过程内临时变量编号，beginProcedure() 时归零
  private int temporaries;

  public SourceWriter() {
    this(DEFAULT_INDENT);
  }

  public SourceWriter(String indentUnit) {
    this.indentUnit = indentUnit;
  }

  /** 按当前缩进输出一行。 */
  public SourceWriter line(String text) {
    out.append(indentUnit.repeat(depth)).append(text).append('\n');
    return this;
  }

  /** 输出多行文本，每行前加当前缩进。 */
  public SourceWriter lines(String text) {
    for (String l : text.split("\n", -1)) {
      if (l.isEmpty()) {
        out.append('\n');
      } else {
        line(l);
      }
    }
    return this;
  }

  public SourceWriter blankLine() {
    out.append('\n');
    return this;
  }

  /** 输出块头并进入下一层缩进。 */
  public SourceWriter open(String header) {
    line(header);
    depth++;
    return this;
  }

  /** 退出当前缩进并输出 {@code closer}。 */
  public SourceWriter close(String closer) {
    if (depth == 0) {
      throw new IllegalStateException("Unbalanced block close: " + closer);
    }
    depth--;
    return line(closer);
  }

  /** 在同一层级切换到相邻块，如 else if 分支。 */
  public SourceWriter reopen(String header) {
    close(header);
    depth++;
    return this;
  }

  public SourceWriter close() {
    return close("}");
  }

  public int depth() {
    return depth;
  }

  void beginProcedure() {
    temporaries = 0;
  }

  /** 返回当前过程内未使用过的临时变量名。 */
  String freshTemporary() {
    int n = temporaries++;
    return n == 0 ? "__temporary" : "__temporary" + n;
  }

  @Override
  public String toString() {
    return out.toString();
  }
}
