/*
Copyright 2024 National Technology & Engineering Solutions of Sandia, LLC (NTESS).
Under the terms of Contract DE-NA0003525 with NTESS,
the U.S. Government retains certain rights in this software.
*/

package gov.sandia.zcalc.language;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNotSame;
import static org.junit.Assert.assertTrue;
import gov.sandia.zcalc.language.function.Sine;
import gov.sandia.zcalc.language.operator.Add;
import gov.sandia.zcalc.language.operator.Multiply;
import gov.sandia.zcalc.language.operator.Subtract;
import gov.sandia.zcalc.language.type.Complex;

import org.junit.Assert;
import org.junit.Test;

public class ExpressionTest {
    protected static Expression postfix(String infix) throws LanguageException {
        return Expression.parse(infix).toPostfix();
    }

    protected void expectPostfix(String expected, String infix) throws LanguageException {
        Expression p = postfix(infix);
        assertTrue(p.postfix);
        assertEquals("postfix of " + infix, expected, p.toString());
    }

    protected void expectSyntaxError(String infix) throws ParseException {
        Expression e = Expression.parse(infix);
        try {
            e.toPostfix();
            Assert.fail("Expected error but did not find one (" + infix + ")");
        } catch(SyntaxException ex) {
            assertEquals("Mismatched brackets in infix expression.", ex.getMessage());
        }
    }

    @Test
    public void testScenarios() throws LanguageException {
        Expression p = postfix("3+4*2");
        assertEquals("[3 4 2 * +]", p.toString());
        assertEquals(new Complex(11), p.evaluate(new Complex(-5, 2)));

        p = postfix("(3+4)*2");
        assertEquals("[3 4 + 2 *]", p.toString());
        assertEquals(new Complex(14), p.evaluate(Complex.ZERO));

        p = postfix("\\sin(z)");
        assertEquals("[z sin]", p.toString());
        assertEquals("[z cos]", p.differentiate().toString());

        expectSyntaxError("(3+4");
    }

    @Test
    public void testPrecedence() throws LanguageException {
        expectPostfix("[z 1 - z 1 + /]",     "(z-1)/(z+1)");
        expectPostfix("[2 z 3 ^ *]",         "2*z^3");
        expectPostfix("[1 2 - 3 -]",         "1-2-3");
        expectPostfix("[2 3 ^ 2 ^]",         "2^3^2");
        expectPostfix("[z 2 ^ neg]",         "-z^2");
        expectPostfix("[z neg 2 *]",         "-z*2");
        expectPostfix("[z sin 1 +]",         "\\sin(z)+1");
        expectPostfix("[z sin 1 +]",         "\\sin z+1");
        expectPostfix("[z 1 + sin cos]",     "\\cos(\\sin(z+1))");
        expectPostfix("[z 2 ^ deriv]",       "\\deriv{z^2}");
        expectPostfix("[z [1,-1] * exp 3 /]", "\\exp(z*[1,-1])/3");
    }

    @Test
    public void testMismatchedBrackets() throws ParseException {
        expectSyntaxError("(3+4");
        expectSyntaxError("3+4)");
        expectSyntaxError("((z)");
        expectSyntaxError("\\sin(z))");
    }

    @Test
    public void testCurlyAndRoundInterchangeable() throws LanguageException {
        assertEquals(postfix("(z+1)*2"), postfix("{z+1}*2"));
        assertEquals(postfix("(z+1)*2"), postfix("{z+1)*2"));
    }

    @Test
    public void testToPostfixIdempotent() throws LanguageException {
        Expression p = postfix("\\log(z)*(z-[0,1])^2");
        Expression q = p.toPostfix();
        assertNotSame(p, q);
        assertEquals(p, q);
        q.add(new Constant(1));
        assertFalse(p.equals(q));
    }

    @Test
    public void testWellFormed() throws LanguageException {
        assertTrue(postfix("z*(3-z)").isWellFormed());
        assertTrue(new Expression().append(new Constant(3)).isWellFormed());
        assertFalse(new Expression().isWellFormed());
        assertFalse(new Expression().append(new Constant(3), new Add()).isWellFormed());
        assertFalse(new Expression().append(new Constant(3), new Constant(4)).isWellFormed());
        assertFalse(new Expression().append(new Add(), new Constant(3), new Constant(4)).isWellFormed());
        assertFalse(new Expression().append(new Sine()).isWellFormed());
    }

    @Test
    public void testSubexpressionStart() {
        // [5 3 4 * -]
        Expression e = new Expression().append(new Constant(5), new Constant(3), new Constant(4), new Multiply(), new Subtract());
        assertEquals(1, e.subexpressionStart(4));
        assertEquals(0, e.subexpressionStart(5));
        assertEquals(0, e.subexpressionStart(1));
        assertEquals(2, e.subexpressionStart(3));
        assertEquals("[3 4 *]", e.slice(1, 4).toString());
    }

    @Test
    public void testSubexpressionStartErrors() {
        Expression e = new Expression().append(new Constant(3), new Add());
        expectIllegal(e, 0);
        expectIllegal(e, 3);
        expectIllegal(e, 2);
    }

    protected void expectIllegal(Expression e, int end) {
        try {
            e.subexpressionStart(end);
            Assert.fail("Expected error for end=" + end + " in " + e);
        } catch(IllegalArgumentException ex) {
            assertTrue(ex.getMessage().length() > 0);
        }
    }

    @Test
    public void testEverySubexpressionWellFormed() throws LanguageException {
        String[] inputs = {
            "3+4*2",
            "\\sin(z^2)*\\exp(-z)/(z-1)",
            "-(z+[1,2])^\\log(z)",
            "\\atan(\\cosh(z)-\\tanh(2*z))+pi*i"
        };
        for (String input : inputs) {
            Expression p = postfix(input);
            assertTrue(input, p.isWellFormed());
            for (int end = 1; end <= p.size(); end++) {
                int start = p.subexpressionStart(end);
                assertTrue(input + " [" + start + "," + end + ")", p.slice(start, end).isWellFormed());
            }
            assertEquals(0, p.subexpressionStart(p.size()));
        }
    }

    @Test
    public void testSliceAndReplace() throws LanguageException {
        Expression p = postfix("z*(3-z)");
        assertEquals("[z 3 z - *]", p.toString());
        Expression inner = p.slice(1, 4);
        assertTrue(inner.postfix);
        inner.add(new Variable());
        assertEquals("[z 3 z - *]", p.toString());

        p.replace(1, 4, new Expression().append(new Constant(2)));
        assertEquals("[z 2 *]", p.toString());
        assertEquals(new Complex(6), p.evaluate(new Complex(3)));
    }

    @Test
    public void testPredicates() {
        assertTrue(new Expression().append(new Constant(0)).isZero());
        assertTrue(new Expression().append(new Constant(1)).isOne());
        assertTrue(new Expression().append(new Variable()).isVariable());
        assertFalse(new Expression().append(new Variable()).isConstant());
        assertFalse(new Expression().append(new Constant(0), new Constant(0), new Add()).isZero());
    }

    @Test
    public void testRender() {
        Expression e = new Expression(false)
            .append(Token.create("("), new Constant(2.5), new Add(), new Constant(new Complex(1, -2)), Token.create(")"))
            .append(new Multiply(), new Constant(3.0), Token.create("neg"), new Variable());
        assertEquals("[( 2.5 + [1,-2] ) * 3 neg z]", e.toString());
        assertEquals("[]", new Expression().toString());
    }

    @Test
    public void testRoundTripThroughInfix() throws LanguageException {
        // Rendering an infix expression and removing the outer brackets gives text the tokenizer accepts.
        String[] inputs = {"(3+4)*2", "z^2-\\sin(z)", "[1,2]*z/{z+1}"};
        for (String input : inputs) {
            Expression infix = Expression.parse(input);
            String text = infix.toString();
            text = text.substring(1, text.length() - 1);
            Complex z = new Complex(0.3, 0.7);
            Expression rendered = Expression.parse(text.replace("sin", "\\sin"));
            assertEquals(input, infix.toPostfix().evaluate(z), rendered.toPostfix().evaluate(z));
        }
    }
}
