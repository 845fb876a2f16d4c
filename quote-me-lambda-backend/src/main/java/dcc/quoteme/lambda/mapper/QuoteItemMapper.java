package dcc.quoteme.lambda.mapper;

import dcc.quoteme.lambda.model.Quote;
import software.amazon.awssdk.services.dynamodb.model.AttributeValue;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

public class QuoteItemMapper {
    private QuoteItemMapper() {
    }

    public static Quote toQuote(Map<String, AttributeValue> item) {
        Quote quote = new Quote();
        quote.setId(string(item, "id"));
        quote.setQuote(string(item, "quote"));
        quote.setAuthor(string(item, "author"));
        quote.setTags(stringList(item.get("tags")));
        quote.setCreatedAt(string(item, "created_at"));
        quote.setUpdatedAt(string(item, "updated_at"));
        quote.setCreatedBy(string(item, "created_by"));
        quote.setUpdatedBy(string(item, "updated_by"));
        quote.setImageUrl(string(item, "image_url"));
        quote.setType(string(item, "type"));
        return quote;
    }

    public static Map<String, AttributeValue> toItem(Quote quote) {
        Map<String, AttributeValue> item = new HashMap<>();
        item.put("id", AttributeValue.builder().s(quote.getId()).build());
        item.put("quote", AttributeValue.builder().s(quote.getQuote()).build());
        item.put("author", AttributeValue.builder().s(quote.getAuthor()).build());
        item.put("tags", tagList(quote.getTags()));
        putIfPresent(item, "created_at", quote.getCreatedAt());
        putIfPresent(item, "updated_at", quote.getUpdatedAt());
        putIfPresent(item, "created_by", quote.getCreatedBy());
        putIfPresent(item, "updated_by", quote.getUpdatedBy());
        putIfPresent(item, "image_url", quote.getImageUrl());
        putIfPresent(item, "type", quote.getType());
        return item;
    }

    public static AttributeValue tagList(List<String> tags) {
        List<AttributeValue> values = new ArrayList<>();
        if (tags != null) {
            for (String tag : tags) {
                values.add(AttributeValue.builder().s(tag).build());
            }
        }
        return AttributeValue.builder().l(values).build();
    }

    /**
     * Tags have been written both as a list and as a string set over time; accept either.
     */
    public static List<String> stringList(AttributeValue value) {
        List<String> result = new ArrayList<>();
        if (value == null) {
            return result;
        }
        if (value.hasL()) {
            for (AttributeValue element : value.l()) {
                if (element.s() != null) {
                    result.add(element.s());
                }
            }
        } else if (value.hasSs()) {
            result.addAll(value.ss());
        }
        return result;
    }

    static String string(Map<String, AttributeValue> item, String name) {
        AttributeValue value = item.get(name);
        if (value == null) {
            return null;
        }
        // OAuth flags store created_at as a number
        return value.s() != null ? value.s() : value.n();
    }

    private static void putIfPresent(Map<String, AttributeValue> item, String name, String value) {
        if (value != null) {
            item.put(name, AttributeValue.builder().s(value).build());
        }
    }
}
