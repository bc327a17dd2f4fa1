/*
Copyright 2024 National Technology & Engineering Solutions of Sandia, LLC (NTESS).
Under the terms of Contract DE-NA0003525 with NTESS,
the U.S. Government retains certain rights in this software.
*/

package gov.sandia.zcalc.language.function;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertTrue;
import gov.sandia.zcalc.calculus.Differentiator;
import gov.sandia.zcalc.language.Constant;
import gov.sandia.zcalc.language.DifferentiationException;
import gov.sandia.zcalc.language.Expression;
import gov.sandia.zcalc.language.Function;
import gov.sandia.zcalc.language.Token;
import gov.sandia.zcalc.language.Variable;
import gov.sandia.zcalc.language.operator.Multiply;
import gov.sandia.zcalc.language.type.Complex;

import java.util.Arrays;
import java.util.HashSet;
import java.util.Set;

import org.junit.Assert;
import org.junit.Test;

/**
    Walks every registered function and checks its derivative rule, both applied directly
    to z and through the chain rule on 2z.
**/
public class DerivativeTableTest {
    protected static final Set<String> noRule = new HashSet<String>(Arrays.asList("re", "im", "abs", "arg", "conj", "deriv"));

    @Test
    public void testEveryNameDistinct() {
        Set<Class<?>> classes = new HashSet<Class<?>>();
        int count = 0;
        for (Token.Factory f : Token.operators.values()) {
            Token t = f.createInstance();
            if (!(t instanceof Function)) continue;
            assertEquals(f.name(), t.toString());
            classes.add(t.getClass());
            count++;
        }
        assertEquals(24, count);
        assertEquals(count, classes.size());
    }

    @Test
    public void testRules() throws DifferentiationException {
        for (Token.Factory f : Token.operators.values()) {
            Token t = f.createInstance();
            if (!(t instanceof Function)) continue;
            Function function = (Function) t;
            if (noRule.contains(f.name())) continue;

            // d/dz f(z)
            Expression direct = new Expression().append(new Variable(), function);
            Expression d = Differentiator.differentiate(direct);
            for (Complex z : FunctionTest.SAMPLES) {
                expectClose(f.name(), FunctionTest.difference(function, z), d.evaluate(z));
            }

            // d/dz f(2z) = 2 f'(2z)
            Expression chained = new Expression().append(new Constant(2), new Variable(), new Multiply(), function);
            d = Differentiator.differentiate(chained);
            for (Complex z : FunctionTest.SAMPLES) {
                Complex numeric = FunctionTest.difference(function, z.multiply(2)).multiply(2);
                expectClose(f.name() + "(2z)", numeric, d.evaluate(z));
            }
        }
    }

    @Test
    public void testMissingRules() {
        for (String name : noRule) {
            Expression e = new Expression().append(new Variable(), Token.create(name));
            try {
                Differentiator.differentiate(e);
                Assert.fail("Expected error but did not find one (" + name + ")");
            } catch(DifferentiationException ex) {
                assertEquals("Derivative not found: " + name, ex.getMessage());
            }
        }
    }

    @Test
    public void testConstantArgument() throws DifferentiationException {
        // A constant argument gives 0 even for functions without a rule.
        for (String name : noRule) {
            Expression e = new Expression().append(new Constant(new Complex(1, 1)), Token.create(name));
            assertTrue(name, Differentiator.differentiate(e).isZero());
        }
    }

    protected static void expectClose(String label, Complex expected, Complex actual) {
        double tolerance = 1e-6 * Math.max(1, expected.abs());
        assertEquals(label + " real", expected.real, actual.real, tolerance);
        assertEquals(label + " imag", expected.imag, actual.imag, tolerance);
    }
}
