package com.kreasipositif.wpsprocessor.validation.check;

import com.kreasipositif.wpsprocessor.domain.WpsBatch;
import com.kreasipositif.wpsprocessor.domain.WpsLine;
import com.kreasipositif.wpsprocessor.validation.RuleCheck;
import com.kreasipositif.wpsprocessor.validation.RuleContext;
import com.kreasipositif.wpsprocessor.validation.RuleTarget;

import java.util.List;
import java.util.Objects;

/**
 * Fails when another record of the same collection carries the same non-empty value.
 * Lines are compared with the other lines of their batch; batches with the peer batches
 * of the same employer.
 */
public record UniqueCheck(String field) implements RuleCheck {

    @Override
    public boolean test(RuleTarget target, RuleContext context) {
        Object value = target.field(field);
        if (Values.isEmpty(value)) {
            return true;
        }
        String text = Values.asText(value);
        if (target.isLine()) {
            List<WpsLine> lines = context.lines();
            for (int i = 0; i < lines.size(); i++) {
                if (i != target.lineIndex()
                        && text.equals(asTextOrNull(RuleTarget.line(target.batch(), lines.get(i), i).field(field)))) {
                    return false;
                }
            }
            return true;
        }
        for (WpsBatch peer : context.peerBatches()) {
            if (!Objects.equals(peer.getReference(), target.batch().getReference())
                    && text.equals(asTextOrNull(RuleTarget.file(peer).field(field)))) {
                return false;
            }
        }
        return true;
    }

    private static String asTextOrNull(Object value) {
        return Values.isEmpty(value) ? null : Values.asText(value);
    }
}
