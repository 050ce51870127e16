package org.proofloop;

import org.proofloop.anchor.AnchorOccurrence;

/**
 * 某个锚点的切片失败；不影响其它锚点
 */
public record AnchorFailure(AnchorOccurrence anchor, String reason) {
}
