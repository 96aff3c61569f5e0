module dev.mars.flowdraw.cli {
    requires org.slf4j;
    requires info.picocli;
    requires dev.mars.flowdraw.flowchart;

    opens dev.mars.flowdraw.cli to info.picocli;
}
