package org.postfixer.compiler.frontend.parser;

/**
 * How the parser handles parenthesized groups.
 */
public enum GroupingMode {
    /**
     * A group is its own construct: the contents are parsed at power 0 and a closing
     * {@code )} is then required and discarded.
     */
    EXPLICIT,
    /**
     * The closing {@code )} is an ordinary postfix operator looked up in the binding-power
     * table. It is consumed wherever its power allows and stays in the tree as a one-child node,
     * so it can bind tighter than an infix operator written before the group closes.
     */
    POSTFIX_DELIMITER
}
