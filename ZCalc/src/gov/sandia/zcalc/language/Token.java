/*
Copyright 2024 National Technology & Engineering Solutions of Sandia, LLC (NTESS).
Under the terms of Contract DE-NA0003525 with NTESS,
the U.S. Government retains certain rights in this software.
*/

package gov.sandia.zcalc.language;

import gov.sandia.zcalc.language.function.AbsoluteValue;
import gov.sandia.zcalc.language.function.ArcCosine;
import gov.sandia.zcalc.language.function.ArcSine;
import gov.sandia.zcalc.language.function.ArcTangent;
import gov.sandia.zcalc.language.function.Argument;
import gov.sandia.zcalc.language.function.Conjugate;
import gov.sandia.zcalc.language.function.Cosecant;
import gov.sandia.zcalc.language.function.Cosine;
import gov.sandia.zcalc.language.function.Cotangent;
import gov.sandia.zcalc.language.function.Derivative;
import gov.sandia.zcalc.language.function.Exp;
import gov.sandia.zcalc.language.function.HyperbolicArcCosine;
import gov.sandia.zcalc.language.function.HyperbolicArcSine;
import gov.sandia.zcalc.language.function.HyperbolicArcTangent;
import gov.sandia.zcalc.language.function.HyperbolicCosine;
import gov.sandia.zcalc.language.function.HyperbolicSine;
import gov.sandia.zcalc.language.function.HyperbolicTangent;
import gov.sandia.zcalc.language.function.Imaginary;
import gov.sandia.zcalc.language.function.Log;
import gov.sandia.zcalc.language.function.Real;
import gov.sandia.zcalc.language.function.Secant;
import gov.sandia.zcalc.language.function.Sine;
import gov.sandia.zcalc.language.function.Tangent;
import gov.sandia.zcalc.language.operator.Add;
import gov.sandia.zcalc.language.operator.Divide;
import gov.sandia.zcalc.language.operator.Multiply;
import gov.sandia.zcalc.language.operator.Negate;
import gov.sandia.zcalc.language.operator.Power;
import gov.sandia.zcalc.language.operator.Subtract;

import java.util.Collections;
import java.util.SortedMap;
import java.util.TreeMap;

/**
    Base class of the token hierarchy for our expression language. A token is one element of an
    Expression, which is a flat sequence in either infix or postfix order rather than a tree.
    Every operation is a subclass that supplies its own precedence, numeric function and
    (for functions) derivative rule. The static table below maps each operation name to a factory,
    and is the only place the tokenizer consults to recognize a name.

    Tokens are immutable, so expressions may share instances freely.
**/
public abstract class Token
{
    public interface Factory
    {
        public String name ();  ///< Unique string for searching in the table of registered operators. Used explicitly by tokenizer.
        public Token  createInstance ();
    }

    /**
        Binding strength during infix-to-postfix conversion. Higher binds tighter.
        Operands and brackets are never compared, but report the top level for completeness.
    **/
    public int precedence ()
    {
        return 4;
    }

    public boolean equals (Object that)
    {
        if (that == null) return false;
        return getClass () == that.getClass ();
    }

    public int hashCode ()
    {
        return getClass ().hashCode ();
    }


    // Static interface ------------------------------------------------------

    private static TreeMap<String,Factory> registry = new TreeMap<String,Factory> ();

    /**
        Read-only view of the operation table, keyed by name.
    **/
    public static final SortedMap<String,Factory> operators = Collections.unmodifiableSortedMap (registry);

    protected static void register (Factory f)
    {
        registry.put (f.name (), f);
    }

    static
    {
        // Functions
        register (AbsoluteValue       .factory ());
        register (ArcCosine           .factory ());
        register (ArcSine             .factory ());
        register (ArcTangent          .factory ());
        register (Argument            .factory ());
        register (Conjugate           .factory ());
        register (Cosecant            .factory ());
        register (Cosine              .factory ());
        register (Cotangent           .factory ());
        register (Derivative          .factory ());
        register (Exp                 .factory ());
        register (HyperbolicArcCosine .factory ());
        register (HyperbolicArcSine   .factory ());
        register (HyperbolicArcTangent.factory ());
        register (HyperbolicCosine    .factory ());
        register (HyperbolicSine      .factory ());
        register (HyperbolicTangent   .factory ());
        register (Imaginary           .factory ());
        register (Log                 .factory ());
        register (Real                .factory ());
        register (Secant              .factory ());
        register (Sine                .factory ());
        register (Tangent             .factory ());

        // Operators
        register (Add     .factory ());
        register (Divide  .factory ());
        register (Multiply.factory ());
        register (Negate  .factory ());
        register (Power   .factory ());
        register (Subtract.factory ());

        // Brackets
        register (Bracket.factory ("(", true));
        register (Bracket.factory (")", false));
        register (Bracket.factory ("{", true));
        register (Bracket.factory ("}", false));
    }

    /**
        @return A new token for the named operation, or null if the name is not registered.
    **/
    public static Token create (String name)
    {
        Factory f = operators.get (name);
        if (f == null) return null;
        return f.createInstance ();
    }
}
