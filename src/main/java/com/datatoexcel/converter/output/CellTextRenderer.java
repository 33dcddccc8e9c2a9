package com.datatoexcel.converter.output;

import java.math.BigDecimal;

import com.datatoexcel.converter.model.DocumentNodeVisitor;
import com.datatoexcel.converter.model.ListNode;
import com.datatoexcel.converter.model.ObjectNode;
import com.datatoexcel.converter.model.ScalarNode;

/**
 * Text of a flattened cell as it appears on a sheet. Used for column widths.
 * Lists and objects never reach a sheet; meeting one is a flattening defect.
 */
class CellTextRenderer implements DocumentNodeVisitor<String> {

    @Override
    public String visitScalar(ScalarNode scalar) {
        Object value = scalar.getValue();
        if (value == null) {
            return "";
        }
        if (value instanceof BigDecimal decimal) {
            return decimal.toPlainString();
        }
        return value.toString();
    }

    @Override
    public String visitList(ListNode list) {
        throw new IllegalStateException("List-valued cell reached the sheet writer: " + list);
    }

    @Override
    public String visitObject(ObjectNode object) {
        throw new IllegalStateException("Object-valued cell reached the sheet writer: " + object);
    }
}
