package org.proofloop.flow;

public record Inheritance(int childContractId, int parentContractId) {
}
