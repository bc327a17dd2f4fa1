/*
Copyright 2024 National Technology & Engineering Solutions of Sandia, LLC (NTESS).
Under the terms of Contract DE-NA0003525 with NTESS,
the U.S. Government retains certain rights in this software.
*/

package gov.sandia.zcalc.db;

import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.Reader;
import java.nio.charset.StandardCharsets;

import org.apache.log4j.Logger;

/**
    Process-wide settings. Defaults are installed first, then the classpath resource
    zcalc.settings (if present) is merged over them. Values may also be changed at run time
    through properties.set(), which is how tests adjust limits.
**/
public class AppData
{
    private static Logger logger = Logger.getLogger (AppData.class);

    public static final String RESOURCE = "zcalc.settings";

    public static MNode properties;

    static
    {
        properties = new MVolatile ();
        setDefaults (properties);
        load (RESOURCE);
    }

    public static void setDefaults (MNode node)
    {
        node.set (1000, "Differentiate", "maxDepth");
        node.set (64,   "Evaluate",      "integerPower");
    }

    /**
        Merges the named classpath resource into properties. A missing resource leaves the
        current values in place. A malformed one is reported and also leaves them in place.
    **/
    public static void load (String resource)
    {
        InputStream stream = AppData.class.getClassLoader ().getResourceAsStream (resource);
        if (stream == null)
        {
            logger.debug ("no " + resource + " on classpath; using defaults");
            return;
        }
        try (Reader reader = new InputStreamReader (stream, StandardCharsets.UTF_8))
        {
            MNode loaded = new MVolatile ();
            Schema.readAll (loaded, reader);
            properties.merge (loaded);
            logger.debug ("loaded " + resource + ":\n" + loaded);
        }
        catch (IOException e)
        {
            logger.warn ("failed to read " + resource + "; keeping previous settings", e);
        }
    }
}
