package org.proofloop.hpg;

/**
 * HPG 节点及其最小特征
 *
 * @param functionId 所属函数；函数节点为自身，合约为 -1
 * @param contractId 所属合约；未解析的哨兵函数为 -1
 */
public record HpgNode(int id, NodeType type, String kind, String name, int line, int endLine,
                      int functionId, int contractId) {
}
