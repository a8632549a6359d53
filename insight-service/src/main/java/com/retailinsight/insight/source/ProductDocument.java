package com.retailinsight.insight.source;

import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.mapping.Field;

/**
 * Projected product document as returned by the fetch pipeline.
 *
 * <p>Fields are typed {@code Object}: the collection has no schema, and one odd value must
 * not fail the cursor. {@link ProductDocumentMapper} turns it
 * into a {@code RawProductRecord}.
 */
@Data
@NoArgsConstructor
public class ProductDocument {

    @Id
    private String id;

    private Object name;
    private Object category;
    private Object price;
    private Object promotion;

    @Field("stock_history")
    private Object stockHistory;
}
