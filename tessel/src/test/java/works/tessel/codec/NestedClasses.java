package works.tessel.codec;

record NestedClasses(Inner inner) {
	record Inner(String prop) { }
}
