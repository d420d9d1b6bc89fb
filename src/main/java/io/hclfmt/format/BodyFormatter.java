package io.hclfmt.format;

import io.hclfmt.ast.Attribute;
import io.hclfmt.ast.Block;
import io.hclfmt.ast.Body;
import io.hclfmt.ast.BodyItem;
import java.util.ArrayList;
import java.util.List;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/** Applies the expression formatter to every attribute of a body and of its blocks. */
public final class BodyFormatter {
  private static final Logger logger = LogManager.getLogger(BodyFormatter.class);

  private BodyFormatter() {}

  /**
   * Formats every attribute expression in the body, recursing into nested blocks.
   *
   * @param body the parsed body
   * @return a new body with formatted expressions
   */
  public static Body format(Body body) {
    List<BodyItem> items = new ArrayList<>(body.items().size());
    for (BodyItem item : body.items()) {
      if (item instanceof Attribute attr) {
        logger.trace("formatting attribute {}", attr.nameText());
        items.add(attr.withExpression(ExpressionFormatter.formatAttribute(attr.expression())));
      } else if (item instanceof Block block) {
        logger.trace("formatting block {}", block.type());
        items.add(block.withBody(format(block.body())));
      } else {
        items.add(item);
      }
    }
    return new Body(items);
  }
}
