package net.llparse.util;

import java.util.Collection;
import org.json.JSONArray;
import org.json.JSONObject;

public final class Util {

    private Util() {}

    public static JSONObject createJSONObject(Object... params) {
        if (params.length % 2 == 1)
            throw new IllegalArgumentException("Invalid parameter amount " +
                "for createJSONObject()");
        JSONObject ret = new JSONObject();
        for (int i = 0; i < params.length; i += 2) {
            if (! (params[i] instanceof String))
                throw new IllegalArgumentException("Invalid parameter " +
                    "type for createJSONObject()");
            Object value = params[i + 1];
            ret.put((String) params[i], (value == null) ? JSONObject.NULL :
                                                          value);
        }
        return ret;
    }

    /* Convert the given objects to strings and collect them into a JSON
     * array, preserving iteration order. */
    public static JSONArray createJSONStringArray(Collection<?> items) {
        JSONArray ret = new JSONArray();
        for (Object o : items) ret.put(String.valueOf(o));
        return ret;
    }

}
