package com.github.tarcv.eregraph;

public interface NodeVisitor<T> {
    T visitLiteral(LiteralNode node);
    T visitAnyChar(AnyCharNode node);
    T visitCharClass(CharClassNode node);
    T visitConcat(ConcatNode node);
    T visitAlternation(AlternationNode node);
    T visitRepeat(RepeatNode node);
    T visitGroup(GroupNode node);
}
