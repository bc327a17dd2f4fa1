/*
Copyright 2024 National Technology & Engineering Solutions of Sandia, LLC (NTESS).
Under the terms of Contract DE-NA0003525 with NTESS,
the U.S. Government retains certain rights in this software.
*/

package gov.sandia.zcalc.language;

/**
    The single independent variable z. Evaluation binds it to the value supplied by the caller.
**/
public class Variable extends Token
{
    public static final String NAME = "z";

    public String toString ()
    {
        return NAME;
    }
}
