package org.kleis.expressions;

/**
 * 表达式树的节点。由外部解析器构造，本库只读取。
 * 所有实现均为不可变值对象。
 *
 * @see ConstExpr
 * @see ObjectExpr
 * @see OperationExpr
 * @see QuantifierExpr
 * @see ConditionalExpr
 */
public interface Expression {
}
