package xyz.vvrf.reactor.exec.registry;

import xyz.vvrf.reactor.exec.node.AbstractAggregateNode;
import xyz.vvrf.reactor.exec.node.ConsumingSinkNode;
import xyz.vvrf.reactor.exec.node.FilterNode;
import xyz.vvrf.reactor.exec.node.HashJoinNode;
import xyz.vvrf.reactor.exec.node.OrderBySinkNode;
import xyz.vvrf.reactor.exec.node.ProjectNode;
import xyz.vvrf.reactor.exec.node.RecordBatchReaderSourceNode;
import xyz.vvrf.reactor.exec.node.SchemaSourceNode;
import xyz.vvrf.reactor.exec.node.SelectKSinkNode;
import xyz.vvrf.reactor.exec.node.SinkNode;
import xyz.vvrf.reactor.exec.node.SourceNode;
import xyz.vvrf.reactor.exec.node.TableSinkNode;
import xyz.vvrf.reactor.exec.node.TableSourceNode;
import xyz.vvrf.reactor.exec.node.UnionNode;

/**
 * 内置节点类型及其工厂名称。
 */
public final class BuiltinExecFactories {

    private BuiltinExecFactories() {}

    public static void registerAll(ExecFactoryRegistry registry) {
        registry.addFactory("source", SourceNode::make);
        registry.addFactory("table_source", TableSourceNode::make);
        registry.addFactory("record_batch_reader_source", RecordBatchReaderSourceNode::make);
        registry.addFactory("array_vector_source", SchemaSourceNode::makeArrayVectorSource);
        registry.addFactory("exec_batch_source", SchemaSourceNode::makeExecBatchSource);
        registry.addFactory("record_batch_source", SchemaSourceNode::makeRecordBatchSource);
        registry.addFactory("sink", SinkNode::make);
        registry.addFactory("order_by_sink", OrderBySinkNode::make);
        registry.addFactory("select_k_sink", SelectKSinkNode::make);
        registry.addFactory("consuming_sink", ConsumingSinkNode::make);
        registry.addFactory("table_sink", TableSinkNode::make);
        registry.addFactory("filter", FilterNode::make);
        registry.addFactory("project", ProjectNode::make);
        registry.addFactory("aggregate", AbstractAggregateNode::make);
        registry.addFactory("hashjoin", HashJoinNode::make);
        registry.addFactory("union", UnionNode::make);
    }
}
