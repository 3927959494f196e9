package com.github.automationir.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Recursive boolean/comparison tree. A node is a device attribute reference, a literal or an
 * operator applied to arguments. Operator arity is not enforced here since expressions originate
 * from external documents; the validator reports arity violations.
 */
public abstract class Expression {

  private Expression() {}

  public abstract <R> R accept(Visitor<R> visitor);

  public static Expression ref(final String device, final String path) {
    return new Ref(new DeviceRef(device, path));
  }

  public static Expression lit(final Literal literal) {
    return new Lit(literal);
  }

  public static Expression op(final Operator operator, final Expression... args) {
    final List<Expression> list = new ArrayList<>();
    Collections.addAll(list, args);
    return new Op(operator, list);
  }

  public static Expression op(final Operator operator, final List<Expression> args) {
    return new Op(operator, args);
  }

  public interface Visitor<R> {
    R visitRef(Ref ref);

    R visitLit(Lit lit);

    R visitOp(Op op);
  }

  public static final class Ref extends Expression {
    private final DeviceRef ref;

    public Ref(final DeviceRef ref) {
      this.ref = Objects.requireNonNull(ref, "ref");
    }

    public DeviceRef getRef() {
      return ref;
    }

    @Override
    public <R> R accept(Visitor<R> visitor) {
      return visitor.visitRef(this);
    }

    @Override
    public boolean equals(Object o) {
      return o instanceof Ref && ref.equals(((Ref) o).ref);
    }

    @Override
    public int hashCode() {
      return ref.hashCode();
    }

    @Override
    public String toString() {
      return "Ref [" + ref + "]";
    }
  }

  public static final class Lit extends Expression {
    private final Literal literal;

    public Lit(final Literal literal) {
      this.literal = Objects.requireNonNull(literal, "literal");
    }

    public Literal getLiteral() {
      return literal;
    }

    @Override
    public <R> R accept(Visitor<R> visitor) {
      return visitor.visitLit(this);
    }

    @Override
    public boolean equals(Object o) {
      return o instanceof Lit && literal.equals(((Lit) o).literal);
    }

    @Override
    public int hashCode() {
      return literal.hashCode();
    }

    @Override
    public String toString() {
      return "Lit [" + literal + "]";
    }
  }

  public static final class Op extends Expression {
    private final Operator operator;
    private final List<Expression> args;

    public Op(final Operator operator, final List<Expression> args) {
      this.operator = Objects.requireNonNull(operator, "operator");
      this.args = Collections.unmodifiableList(new ArrayList<>(args));
    }

    public Operator getOperator() {
      return operator;
    }

    public List<Expression> getArgs() {
      return args;
    }

    @Override
    public <R> R accept(Visitor<R> visitor) {
      return visitor.visitOp(this);
    }

    @Override
    public boolean equals(Object o) {
      if (!(o instanceof Op)) {
        return false;
      }
      Op other = (Op) o;
      return operator == other.operator && args.equals(other.args);
    }

    @Override
    public int hashCode() {
      return Objects.hash(operator, args);
    }

    @Override
    public String toString() {
      return "Op [" + operator + ", args=" + args + "]";
    }
  }
}
