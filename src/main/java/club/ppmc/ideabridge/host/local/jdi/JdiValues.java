/**
 * JdiValues.java
 *
 * JDI 值的字符串表示。
 */
package club.ppmc.ideabridge.host.local.jdi;

import club.ppmc.ideabridge.model.debug.VariableInfo;
import com.sun.jdi.ArrayReference;
import com.sun.jdi.ObjectReference;
import com.sun.jdi.PrimitiveValue;
import com.sun.jdi.StringReference;
import com.sun.jdi.Value;

final class JdiValues {

    private JdiValues() {}

    static String valueToString(Value jdiValue) {
        if (jdiValue == null) return "null";
        if (jdiValue instanceof StringReference strRef) return "\"" + strRef.value() + "\"";
        if (jdiValue instanceof PrimitiveValue) return jdiValue.toString();
        if (jdiValue instanceof ArrayReference array) {
            return array.type().name() + " (length=" + array.length() + ", id=" + array.uniqueID() + ")";
        }
        if (jdiValue instanceof ObjectReference objRef) return objRef.type().name() + " (id=" + objRef.uniqueID() + ")";
        return "N/A";
    }

    static String typeName(Value jdiValue) {
        return jdiValue == null ? "null" : jdiValue.type().name();
    }

    static VariableInfo describe(String name, Value jdiValue) {
        return new VariableInfo(name, typeName(jdiValue), valueToString(jdiValue));
    }
}
