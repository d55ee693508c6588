package org.energytrade.engine;

import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * 过滤表达式解析（尽力而为）
 * 支持：sourceType='SOLAR'、availableQuantity >= 10
 * 无法识别的部分直接忽略
 */
public class FilterExpressionParser {

    private static final Pattern SOURCE_TYPE = Pattern.compile("sourceType\\s*(?:[='\"]\\s*)+(\\w+)",
            Pattern.CASE_INSENSITIVE);
    private static final Pattern AVAILABLE_QUANTITY = Pattern.compile("availableQuantity\\s*>=?\\s*(\\d+(?:\\.\\d+)?)",
            Pattern.CASE_INSENSITIVE);

    public FilterCriteria parse(String expression) {
        FilterCriteria criteria = new FilterCriteria();
        if (expression == null || expression.isBlank()) {
            return criteria;
        }
        Matcher sourceMatcher = SOURCE_TYPE.matcher(expression);
        if (sourceMatcher.find()) {
            criteria.setSourceType(sourceMatcher.group(1).toUpperCase(Locale.ROOT));
        }
        Matcher quantityMatcher = AVAILABLE_QUANTITY.matcher(expression);
        if (quantityMatcher.find()) {
            criteria.setMinAvailableQuantity(Double.parseDouble(quantityMatcher.group(1)));
        }
        return criteria;
    }

    /**
     * 表达式优先，缺失的字段由结构化意图补齐
     */
    public FilterCriteria merge(FilterCriteria fromExpression, String intentSourceType,
                                Integer intentQuantity, TimeWindow intentWindow) {
        FilterCriteria merged = fromExpression == null ? new FilterCriteria() : fromExpression;
        if (merged.getSourceType() == null && intentSourceType != null && !intentSourceType.isBlank()) {
            merged.setSourceType(intentSourceType.toUpperCase(Locale.ROOT));
        }
        if (merged.getMinAvailableQuantity() == null && intentQuantity != null && intentQuantity > 0) {
            merged.setMinAvailableQuantity(intentQuantity.doubleValue());
        }
        if (merged.getTimeWindow() == null && intentWindow != null && intentWindow.isBounded()) {
            merged.setTimeWindow(intentWindow);
        }
        return merged;
    }
}
