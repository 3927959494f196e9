package com.github.automationir.codec;

/**
 * Lexical token of the guard and invariant expression language.
 */
final class Token {
  static enum Type {
    LPAREN, RPAREN, OP, LIT, REF, KEYWORD, BAD, EOF;
  }

  static final Token EOF = new Token(Type.EOF, "");

  private final Type type;
  private final String text;

  Token(final Type type, final String text) {
    this.type = type;
    this.text = text;
  }

  Type getType() {
    return type;
  }

  String getText() {
    return text;
  }

  boolean is(final Type type, final String text) {
    return this.type == type && this.text.equals(text);
  }

  @Override
  public String toString() {
    return type == Type.EOF ? "end of input" : "'" + text + "'";
  }
}
