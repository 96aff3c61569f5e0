module dev.mars.flowdraw.flowchart {
    requires java.xml;
    requires org.slf4j;
    requires transitive dev.mars.flowdraw.core;

    exports dev.mars.flowdraw.flowchart;
}
