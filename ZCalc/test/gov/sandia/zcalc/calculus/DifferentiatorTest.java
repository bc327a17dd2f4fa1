/*
Copyright 2024 National Technology & Engineering Solutions of Sandia, LLC (NTESS).
Under the terms of Contract DE-NA0003525 with NTESS,
the U.S. Government retains certain rights in this software.
*/

package gov.sandia.zcalc.calculus;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertTrue;
import gov.sandia.zcalc.db.AppData;
import gov.sandia.zcalc.language.Bracket;
import gov.sandia.zcalc.language.Constant;
import gov.sandia.zcalc.language.DifferentiationException;
import gov.sandia.zcalc.language.Expression;
import gov.sandia.zcalc.language.LanguageException;
import gov.sandia.zcalc.language.Variable;
import gov.sandia.zcalc.language.operator.Add;
import gov.sandia.zcalc.language.type.Complex;

import org.junit.After;
import org.junit.Assert;
import org.junit.Test;

public class DifferentiatorTest {
    protected static final Complex[] SAMPLES = {
        new Complex(0.7, 0.2),
        new Complex(1.3, -0.5),
        new Complex(-0.4, 0.9)
    };
    protected static final double STEP = 1e-5;

    @After
    public void restoreSettings() {
        AppData.setDefaults(AppData.properties);
    }

    protected static Expression postfix(String infix) throws LanguageException {
        return Expression.parse(infix).toPostfix();
    }

    protected void expectSymbolic(String expected, String infix) throws LanguageException {
        assertEquals("d/dz " + infix, expected, postfix(infix).differentiate().toString());
    }

    /**
        Checks the symbolic derivative against a central difference of the expression itself.
    **/
    protected void expectNumeric(String infix) throws LanguageException {
        Expression f = postfix(infix);
        Expression d = f.differentiate();
        Complex h = new Complex(STEP);
        for (Complex z : SAMPLES) {
            Complex numeric  = f.evaluate(z.add(h)).subtract(f.evaluate(z.subtract(h))).multiply(1 / (2 * STEP));
            Complex symbolic = d.evaluate(z);
            double tolerance = 1e-6 * Math.max(1, numeric.abs());
            assertEquals(infix + " at " + z + " real", numeric.real, symbolic.real, tolerance);
            assertEquals(infix + " at " + z + " imag", numeric.imag, symbolic.imag, tolerance);
        }
    }

    protected void expectFail(Expression e, String expectedError) {
        try {
            Differentiator.differentiate(e);
            Assert.fail("Expected error but did not find one (" + e + ")");
        } catch(DifferentiationException ex) {
            if(!ex.getMessage().startsWith(expectedError)) {
                Assert.fail("Expected error message '" + expectedError + "' but found '" + ex.getMessage() + "' (" + e + ")");
            }
        }
    }

    @Test
    public void testLeaves() throws LanguageException {
        expectSymbolic("[1]", "z");
        expectSymbolic("[0]", "3");
        expectSymbolic("[0]", "[1,2]");
        expectSymbolic("[0]", "pi");
    }

    @Test
    public void testSimplifications() throws LanguageException {
        expectSymbolic("[z cos]",                 "\\sin(z)");
        expectSymbolic("[2 z *]",                 "z^2");
        expectSymbolic("[3 z 2 ^ *]",             "z^3");
        expectSymbolic("[1]",                     "z^1");
        expectSymbolic("[0]",                     "z^0");
        expectSymbolic("[0]",                     "0^z");
        expectSymbolic("[z z +]",                 "z*z");
        expectSymbolic("[3]",                     "3*z");
        expectSymbolic("[3]",                     "z*3");
        expectSymbolic("[1]",                     "z+3");
        expectSymbolic("[1]",                     "3+z");
        expectSymbolic("[-1]",                    "3-z");
        expectSymbolic("[1]",                     "z-3");
        expectSymbolic("[1 1 +]",                 "z+z");
        expectSymbolic("[1 1 -]",                 "z-z");
        expectSymbolic("[-1]",                    "-z");
        expectSymbolic("[1 3 /]",                 "z/3");
        expectSymbolic("[-1 z z * /]",            "1/z");
        expectSymbolic("[2 z * z 2 ^ cos *]",     "\\sin(z^2)");
        expectSymbolic("[0]",                     "\\sin(2)");
        expectSymbolic("[2 z ^ 2 log *]",         "2^z");
        expectSymbolic("[z z z 1 - ^ * z z ^ z log * +]", "z^z");
    }

    @Test
    public void testFiniteDifferences() throws LanguageException {
        expectNumeric("z^2");
        expectNumeric("\\sin(z)");
        expectNumeric("z*z");
        expectNumeric("z/[2,-1]");
        expectNumeric("1/z");
        expectNumeric("(z+1)/(z-2)");
        expectNumeric("z^z");
        expectNumeric("2^z");
        expectNumeric("z^(2*z)");
        expectNumeric("(z^2+1)^3");
        expectNumeric("\\sin(z)*\\cos(z)");
        expectNumeric("\\exp(z^2)/\\log(z+3)");
        expectNumeric("-(z*[0,1])^2");
        expectNumeric("\\atan(\\sinh(z)/2)");
        expectNumeric("z-\\tanh(z)*3");
    }

    @Test
    public void testInputUnchanged() throws LanguageException {
        Expression f = postfix("z*\\sin(z)");
        String before = f.toString();
        f.differentiate();
        assertEquals(before, f.toString());
    }

    @Test
    public void testErrors() throws LanguageException {
        expectFail(Expression.parse("z+1"), "Can only differentiate a postfix expression");
        expectFail(new Expression().append(new Variable(), new Add()), "Expression is not well-formed");
        expectFail(new Expression(), "Expression is not well-formed");
        expectFail(new Expression().append(new Bracket("(", true)), "Unrecognized token to differentiate");
        expectFail(postfix("\\re(z)"), "Derivative not found: re");
        expectFail(postfix("\\abs(z^2)"), "Derivative not found: abs");
    }

    @Test
    public void testDepthLimit() throws LanguageException {
        Expression nested = postfix("\\sin(\\sin(\\sin(\\sin(z))))");
        assertTrue(nested.differentiate().size() > 0);

        AppData.properties.set(2, "Differentiate", "maxDepth");
        expectFail(nested, "Expression nested too deeply");
        assertEquals("[z cos z sin cos *]", postfix("\\sin(\\sin(z))").differentiate().toString());
    }

    @Test
    public void testLongChains() throws LanguageException {
        StringBuilder sum = new StringBuilder("z");
        for (int i = 1; i < 1101; i++) sum.append("+z");
        Expression d = postfix(sum.toString()).differentiate();
        assertEquals(new Complex(1101), d.evaluate(new Complex(0.5, 2)));

        StringBuilder mixed = new StringBuilder("\\sin(z)");
        for (int i = 1; i < 1500; i++) mixed.append(i % 2 == 0 ? "+z" : "-3");
        Complex z = new Complex(0.3, -0.2);
        Complex expected = z.cos().add(749);
        Complex actual   = postfix(mixed.toString()).differentiate().evaluate(z);
        assertEquals(expected.real, actual.real, 1e-9);
        assertEquals(expected.imag, actual.imag, 1e-9);
    }

    @Test
    public void testChainsAtMinimumDepth() throws LanguageException {
        AppData.properties.set(1, "Differentiate", "maxDepth");
        assertEquals("[1 1 + 1 + 1 + 1 -]", postfix("z+z+z+z-z").differentiate().toString());
        assertEquals(new Complex(4), postfix("z+z+z+z+z-z").differentiate().evaluate(new Complex(7)));
        assertEquals(new Complex(32), postfix("z*z*z*z").differentiate().evaluate(new Complex(2)));
        assertEquals("[3 z * 3 z * + 2 +]", postfix("3*z*z+2*z").differentiate().toString());

        // The guard still applies to operands that nest below a chain.
        expectFail(postfix("z+\\sin(\\sin(z))"), "Expression nested too deeply");
    }

    @Test
    public void testResolveDerivatives() throws LanguageException {
        Expression e = postfix("\\deriv(z^2)+1");
        assertEquals("[z 2 ^ deriv 1 +]", e.toString());
        Expression r = Differentiator.resolveDerivatives(e);
        assertEquals("[2 z * 1 +]", r.toString());
        assertEquals("[z 2 ^ deriv 1 +]", e.toString());
        assertEquals(new Complex(7), r.evaluate(new Complex(3)));
    }

    @Test
    public void testResolveNestedDerivatives() throws LanguageException {
        Expression e = postfix("\\deriv(\\deriv(z^3))");
        assertEquals("[z 3 ^ deriv deriv]", e.toString());
        Expression r = Differentiator.resolveDerivatives(e);
        assertEquals(new Complex(12), r.evaluate(new Complex(2)));

        r = Differentiator.resolveDerivatives(postfix("z*\\deriv(\\sin(z))-\\deriv(z)"));
        assertEquals("[z z cos * 1 -]", r.toString());
    }

    @Test
    public void testResolveWithoutMarkers() throws LanguageException {
        Expression e = postfix("z*2");
        assertEquals(e, Differentiator.resolveDerivatives(e));
        expectFailResolve(Expression.parse("\\deriv(z)"));
    }

    protected void expectFailResolve(Expression e) {
        try {
            Differentiator.resolveDerivatives(e);
            Assert.fail("Expected error but did not find one (" + e + ")");
        } catch(DifferentiationException ex) {
            assertEquals("Can only differentiate a postfix expression.", ex.getMessage());
        }
    }

    @Test
    public void testHelpers() {
        Expression zero = Differentiator.constant(0);
        Expression one  = Differentiator.constant(1);
        Expression z    = new Expression().append(new Variable());
        assertTrue(Differentiator.multiply(z, zero).isZero());
        assertEquals(z, Differentiator.multiply(one, z));
        assertEquals(z, Differentiator.add(zero, z));
        assertEquals("[z neg]", Differentiator.negate(z).toString());
        assertEquals("[-2]", Differentiator.negate(new Expression().append(new Constant(2))).toString());
        assertEquals("[0]", Differentiator.negate(zero).toString());
    }
}
